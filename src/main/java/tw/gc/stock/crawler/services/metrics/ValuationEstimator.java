package tw.gc.stock.crawler.services.metrics;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Cheap / fair / expensive price bands from five independent estimators.
 *
 * <h3>Estimators:</h3>
 * <ul>
 *   <li><b>price</b> - 20th/50th/80th percentile of historical closing prices</li>
 *   <li><b>dividend</b> - average annual dividend x 15/20/30 (target yields of
 *       about 6.6%, 5% and 3.3%)</li>
 *   <li><b>eps</b> - trailing four quarter EPS x payout ratio x 15/20/30</li>
 *   <li><b>pbr</b> - 20th/50th/80th percentile of historical price-to-book x
 *       current book value per share</li>
 *   <li><b>per</b> - 10th/50th/80th percentile of historical P/E x average
 *       annual EPS</li>
 * </ul>
 *
 * The final band blends the five with fixed weights. An estimator without
 * input contributes a zero band.
 */
public class ValuationEstimator {

    static final double WEIGHT_PRICE = 0.20;
    static final double WEIGHT_DIVIDEND = 0.29;
    static final double WEIGHT_EPS = 0.30;
    static final double WEIGHT_PBR = 0.20;
    static final double WEIGHT_PER = 0.01;

    private static final double[] YIELD_MULTIPLES = {15, 20, 30};

    private final double defaultPayoutRatio;

    public ValuationEstimator(double defaultPayoutRatio) {
        this.defaultPayoutRatio = defaultPayoutRatio;
    }

    public record Band(double cheap, double fair, double expensive) {

        public static final Band ZERO = new Band(0.0, 0.0, 0.0);
    }

    /**
     * History of one security over the lookback window.
     *
     * @param closingPrice       close of the valuation date
     * @param closingPrices      daily closes in the window
     * @param annualDividends    year to total dividend of that year
     * @param payoutRatios       payout ratios (%) of the dividends in the window
     * @param lastFourEps        trailing four quarter EPS of the security
     * @param priceToBookRatios  daily price-to-book ratios in the window
     * @param netAssetValue      current book value per share
     * @param priceEarningRatios daily P/E in the window
     * @param annualEps          year to EPS of that year
     * @param yearCount          distinct years the closes came from
     */
    public record Inputs(
            double closingPrice,
            List<Double> closingPrices,
            Map<Integer, Double> annualDividends,
            List<Double> payoutRatios,
            double lastFourEps,
            List<Double> priceToBookRatios,
            double netAssetValue,
            List<Double> priceEarningRatios,
            Map<Integer, Double> annualEps,
            int yearCount
    ) {}

    public record Valuation(
            Band price,
            Band dividend,
            Band eps,
            Band pbr,
            Band per,
            Band blended,
            double percentage,
            int yearCount
    ) {}

    public Valuation estimate(Inputs in) {
        Band price = percentileBand(positive(in.closingPrices()), 0.2, 0.5, 0.8, 1.0);
        Band dividend = multipleBand(average(in.annualDividends().values()));
        Band eps = multipleBand(in.lastFourEps() * payoutRatio(in.payoutRatios()) / 100.0);
        Band pbr = in.netAssetValue() > 0
                ? percentileBand(positive(in.priceToBookRatios()), 0.2, 0.5, 0.8, in.netAssetValue())
                : Band.ZERO;
        Band per = percentileBand(positive(in.priceEarningRatios()), 0.1, 0.5, 0.8,
                average(in.annualEps().values()));

        Band blended = new Band(
                blend(price.cheap(), dividend.cheap(), eps.cheap(), pbr.cheap(), per.cheap()),
                blend(price.fair(), dividend.fair(), eps.fair(), pbr.fair(), per.fair()),
                blend(price.expensive(), dividend.expensive(), eps.expensive(), pbr.expensive(), per.expensive()));

        return new Valuation(price, dividend, eps, pbr, per, blended,
                percentage(in.closingPrice(), blended), in.yearCount());
    }

    /**
     * Distance of the close from the cheap price, in units of (fair - cheap), as a percentage.
     */
    public static double percentage(double closingPrice, Band band) {
        double span = band.fair() - band.cheap();
        if (span == 0.0) {
            return 0.0;
        }
        return (closingPrice - band.cheap()) / span * 100.0;
    }

    /**
     * Average payout ratio within (0, 200], or the configured default.
     */
    double payoutRatio(List<Double> ratios) {
        List<Double> usable = ratios.stream()
                .filter(r -> r != null && r > 0 && r <= 200)
                .toList();
        return usable.isEmpty() ? defaultPayoutRatio : average(usable);
    }

    // ========== Helpers ==========

    private static Band percentileBand(List<Double> values, double low, double mid, double high, double scale) {
        if (values.isEmpty() || scale <= 0.0) {
            return Band.ZERO;
        }
        return new Band(
                Percentiles.of(values, low) * scale,
                Percentiles.of(values, mid) * scale,
                Percentiles.of(values, high) * scale);
    }

    private static Band multipleBand(double base) {
        if (base <= 0) {
            return Band.ZERO;
        }
        return new Band(base * YIELD_MULTIPLES[0], base * YIELD_MULTIPLES[1], base * YIELD_MULTIPLES[2]);
    }

    private static double blend(double price, double dividend, double eps, double pbr, double per) {
        return price * WEIGHT_PRICE + dividend * WEIGHT_DIVIDEND + eps * WEIGHT_EPS
                + pbr * WEIGHT_PBR + per * WEIGHT_PER;
    }

    private static List<Double> positive(List<Double> values) {
        return values.stream().filter(v -> v != null && v > 0).toList();
    }

    private static double average(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
