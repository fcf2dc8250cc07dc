package tw.gc.stock.crawler.services.metrics;

import tw.gc.stock.crawler.entities.DailyQuote;

import java.util.List;

/**
 * Simple moving averages of the closing price.
 *
 * <p>A window wider than the available history is left at 0; the average is
 * never extrapolated from a shorter history.</p>
 */
public final class MovingAverages {

    public static final int[] WINDOWS = {5, 10, 20, 60, 120, 240};

    /**
     * Widest window, i.e. how many rows a caller has to load.
     */
    public static final int MAX_WINDOW = 240;

    private MovingAverages() {
    }

    /**
     * @param closesNewestFirst closing prices ending at the current date, newest first
     */
    public static double average(List<Double> closesNewestFirst, int window) {
        if (window <= 0 || closesNewestFirst.size() < window) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < window; i++) {
            sum += closesNewestFirst.get(i);
        }
        return sum / window;
    }

    /**
     * Writes every window onto {@code target}.
     */
    public static void apply(DailyQuote target, List<Double> closesNewestFirst) {
        target.setMovingAverage5(average(closesNewestFirst, 5));
        target.setMovingAverage10(average(closesNewestFirst, 10));
        target.setMovingAverage20(average(closesNewestFirst, 20));
        target.setMovingAverage60(average(closesNewestFirst, 60));
        target.setMovingAverage120(average(closesNewestFirst, 120));
        target.setMovingAverage240(average(closesNewestFirst, 240));
    }
}
