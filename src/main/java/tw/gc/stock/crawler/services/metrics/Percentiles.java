package tw.gc.stock.crawler.services.metrics;

import java.util.Arrays;
import java.util.Collection;

/**
 * Percentile by linear interpolation between order statistics, the same
 * definition as PostgreSQL {@code percentile_cont} and Excel
 * {@code PERCENTILE.INC}: rank {@code p * (n - 1)} over the sorted values.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param values sample, any order; not modified
     * @param p      fraction in [0, 1]
     * @return the interpolated percentile, 0 for an empty sample
     */
    public static double of(Collection<Double> values, double p) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        return ofSorted(sorted, p);
    }

    public static double ofSorted(double[] sorted, double p) {
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Percentile fraction out of range: " + p);
        }
        int n = sorted.length;
        if (n == 0) {
            return 0.0;
        }
        if (n == 1) {
            return sorted[0];
        }
        double rank = p * (n - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
