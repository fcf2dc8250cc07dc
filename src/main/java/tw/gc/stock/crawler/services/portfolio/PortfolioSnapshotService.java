package tw.gc.stock.crawler.services.portfolio;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.stock.crawler.config.CrawlerProperties;
import tw.gc.stock.crawler.entities.DailyMoneyHistory;
import tw.gc.stock.crawler.entities.DailyMoneyHistoryDetail;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.StockOwnershipDetail;
import tw.gc.stock.crawler.repositories.DailyMoneyHistoryDetailRepository;
import tw.gc.stock.crawler.repositories.DailyMoneyHistoryRepository;
import tw.gc.stock.crawler.repositories.DailyQuoteRepository;
import tw.gc.stock.crawler.repositories.StockOwnershipDetailRepository;
import tw.gc.stock.crawler.services.portfolio.SnapshotCalculator.LotValuation;
import tw.gc.stock.crawler.services.portfolio.SnapshotCalculator.MemberTotals;
import tw.gc.stock.crawler.services.portfolio.SnapshotCalculator.SecurityPosition;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Daily mark-to-market of every member's holdings.
 *
 * <h3>Per member and date:</h3>
 * <ul>
 *   <li>One {@code daily_money_history_detail} row per held security, rebuilt
 *       from scratch on every run</li>
 *   <li>One {@code daily_money_history} row, updated in place on rerun, with
 *       the previous snapshot's figures copied into {@code previous_day_*}</li>
 * </ul>
 *
 * Members are included while they hold an open lot or sold one within
 * {@code crawler.portfolio.recently-closed-days}.
 */
@Service
@Slf4j
public class PortfolioSnapshotService {

    private final StockOwnershipDetailRepository ownershipRepository;
    private final DailyQuoteRepository dailyQuoteRepository;
    private final DailyMoneyHistoryRepository moneyHistoryRepository;
    private final DailyMoneyHistoryDetailRepository moneyHistoryDetailRepository;
    private final TransactionTemplate transactionTemplate;
    private final int recentlyClosedDays;

    public record SnapshotReport(int members, int securities, int failed) {}

    public PortfolioSnapshotService(StockOwnershipDetailRepository ownershipRepository,
                                    DailyQuoteRepository dailyQuoteRepository,
                                    DailyMoneyHistoryRepository moneyHistoryRepository,
                                    DailyMoneyHistoryDetailRepository moneyHistoryDetailRepository,
                                    PlatformTransactionManager transactionManager,
                                    CrawlerProperties properties) {
        this.ownershipRepository = ownershipRepository;
        this.dailyQuoteRepository = dailyQuoteRepository;
        this.moneyHistoryRepository = moneyHistoryRepository;
        this.moneyHistoryDetailRepository = moneyHistoryDetailRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.recentlyClosedDays = properties.getPortfolio().getRecentlyClosedDays();
    }

    // ========== Public API ==========

    public SnapshotReport snapshot(LocalDate date) {
        List<Long> members = ownershipRepository.findMembersWithOpenOrRecentlyClosedLots(
                date, date.minusDays(recentlyClosedDays));
        int done = 0;
        int securities = 0;
        int failed = 0;

        for (Long memberId : members) {
            try {
                Integer positions = transactionTemplate.execute(status -> snapshotMember(memberId, date));
                securities += positions == null ? 0 : positions;
                done++;
            } catch (RuntimeException e) {
                log.error("❌ Snapshot failed for member {} on {}", memberId, date, e);
                failed++;
            }
        }

        log.info("💼 Portfolio snapshot for {}: {} members, {} positions, {} failed", date, done, securities, failed);
        return new SnapshotReport(done, securities, failed);
    }

    @Transactional(readOnly = true)
    public Optional<DailyMoneyHistory> getSnapshot(Long memberId, LocalDate date) {
        return moneyHistoryRepository.findByMemberIdAndDate(memberId, date);
    }

    @Transactional(readOnly = true)
    public List<DailyMoneyHistoryDetail> getDetails(Long memberId, LocalDate date) {
        return moneyHistoryDetailRepository.findByMemberIdAndDateOrderBySecurityCodeAsc(memberId, date);
    }

    // ========== Computation ==========

    private int snapshotMember(Long memberId, LocalDate date) {
        List<StockOwnershipDetail> lots = ownershipRepository.findLotsHeldOn(memberId, date);

        Map<String, Double> closes = new HashMap<>();
        List<LotValuation> valuations = lots.stream()
                .map(lot -> SnapshotCalculator.valueLot(lot,
                        closes.computeIfAbsent(lot.getSecurityCode(), code -> closingPrice(code, date))))
                .toList();
        List<SecurityPosition> positions = SnapshotCalculator.aggregate(valuations);
        MemberTotals totals = SnapshotCalculator.totals(positions);

        // Details are rebuilt, never patched
        moneyHistoryDetailRepository.deleteByMemberIdAndDate(memberId, date);
        for (SecurityPosition position : positions) {
            moneyHistoryDetailRepository.save(DailyMoneyHistoryDetail.builder()
                    .memberId(memberId)
                    .date(date)
                    .securityCode(position.securityCode())
                    .closingPrice(position.closingPrice())
                    .totalShares(position.totalShares())
                    .cost(position.cost())
                    .averageUnitPricePerShare(position.averageUnitPrice())
                    .marketValue(position.marketValue())
                    .ratio(position.ratio())
                    .profitAndLoss(position.profitAndLoss())
                    .profitAndLossPercentage(position.profitAndLossPercentage())
                    .build());
        }

        DailyMoneyHistory history = moneyHistoryRepository.findByMemberIdAndDate(memberId, date)
                .orElseGet(() -> DailyMoneyHistory.builder().memberId(memberId).date(date).build());
        history.setMarketValue(totals.marketValue());
        history.setCost(totals.cost());
        history.setProfitAndLoss(totals.profitAndLoss());
        history.setProfitAndLossPercentage(totals.profitAndLossPercentage());

        Optional<DailyMoneyHistory> previous =
                moneyHistoryRepository.findFirstByMemberIdAndDateLessThanOrderByDateDesc(memberId, date);
        history.setPreviousDayMarketValue(previous.map(DailyMoneyHistory::getMarketValue).orElse(0.0));
        history.setPreviousDayProfitAndLoss(previous.map(DailyMoneyHistory::getProfitAndLoss).orElse(0.0));
        history.setPreviousDayProfitAndLossPercentage(
                previous.map(DailyMoneyHistory::getProfitAndLossPercentage).orElse(0.0));
        moneyHistoryRepository.save(history);

        log.debug("Member {} on {}: market value {}, P&L {}", memberId, date,
                totals.marketValue(), totals.profitAndLoss());
        return positions.size();
    }

    /**
     * Close of the latest quote up to {@code date}, 0 when the security never traded.
     */
    private double closingPrice(String code, LocalDate date) {
        return dailyQuoteRepository.findFirstBySecurityCodeAndDateLessThanEqualOrderByDateDesc(code, date)
                .map(DailyQuote::getClosingPrice)
                .orElse(0.0);
    }
}
