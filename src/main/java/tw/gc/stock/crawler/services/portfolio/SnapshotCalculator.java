package tw.gc.stock.crawler.services.portfolio;

import tw.gc.stock.crawler.entities.StockOwnershipDetail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mark-to-market arithmetic for a member's lots.
 *
 * <p>Cost is signed negative (money paid out), so profit and loss is simply
 * market value + cost, and its percentage is taken against |cost|.</p>
 */
public final class SnapshotCalculator {

    private SnapshotCalculator() {
    }

    public record LotValuation(String securityCode, long shares, double closingPrice,
                               double marketValue, double cost) {}

    public record SecurityPosition(String securityCode, double closingPrice, long totalShares, double cost,
                                   double averageUnitPrice, double marketValue, double ratio,
                                   double profitAndLoss, double profitAndLossPercentage) {}

    public record MemberTotals(double marketValue, double cost, double profitAndLoss,
                               double profitAndLossPercentage) {

        public static final MemberTotals ZERO = new MemberTotals(0.0, 0.0, 0.0, 0.0);
    }

    public static LotValuation valueLot(StockOwnershipDetail lot, double closingPrice) {
        long shares = lot.getShareQuantity() == null ? 0L : lot.getShareQuantity();
        double marketValue = shares * closingPrice;
        double cost = -(shares * lot.unitCost());
        return new LotValuation(lot.getSecurityCode(), shares, closingPrice, marketValue, cost);
    }

    /**
     * Groups lot valuations per security, keeping the order in which securities
     * first appear. {@code ratio} is the security's share of the member's
     * market value, in percent.
     */
    public static List<SecurityPosition> aggregate(List<LotValuation> lots) {
        Map<String, List<LotValuation>> bySecurity = new LinkedHashMap<>();
        for (LotValuation lot : lots) {
            bySecurity.computeIfAbsent(lot.securityCode(), k -> new ArrayList<>()).add(lot);
        }
        double memberMarketValue = lots.stream().mapToDouble(LotValuation::marketValue).sum();

        List<SecurityPosition> positions = new ArrayList<>(bySecurity.size());
        bySecurity.forEach((code, group) -> {
            long shares = group.stream().mapToLong(LotValuation::shares).sum();
            double cost = group.stream().mapToDouble(LotValuation::cost).sum();
            double marketValue = group.stream().mapToDouble(LotValuation::marketValue).sum();
            double profitAndLoss = marketValue + cost;
            positions.add(new SecurityPosition(
                    code,
                    group.get(0).closingPrice(),
                    shares,
                    cost,
                    shares == 0 ? 0.0 : Math.abs(cost) / shares,
                    marketValue,
                    memberMarketValue == 0.0 ? 0.0 : marketValue / memberMarketValue * 100.0,
                    profitAndLoss,
                    percentage(profitAndLoss, cost)));
        });
        return positions;
    }

    public static MemberTotals totals(List<SecurityPosition> positions) {
        double marketValue = positions.stream().mapToDouble(SecurityPosition::marketValue).sum();
        double cost = positions.stream().mapToDouble(SecurityPosition::cost).sum();
        double profitAndLoss = marketValue + cost;
        return new MemberTotals(marketValue, cost, profitAndLoss, percentage(profitAndLoss, cost));
    }

    public static double percentage(double profitAndLoss, double cost) {
        if (cost == 0.0) {
            return 0.0;
        }
        return profitAndLoss / Math.abs(cost) * 100.0;
    }
}
