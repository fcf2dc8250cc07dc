package tw.gc.stock.crawler.services.metrics;

import tw.gc.stock.crawler.entities.DailyQuote;

import java.time.LocalDate;
import java.util.List;

/**
 * Highest, lowest and average closing price over a trailing window of quotes.
 * Ties keep the earliest date. Rows without a trade (closing price 0) are
 * ignored.
 */
public record YearlyExtrema(
        double maximum,
        LocalDate maximumDate,
        double minimum,
        LocalDate minimumDate,
        double average
) {

    /**
     * Trading days in the window, roughly one year.
     */
    public static final int WINDOW = 240;

    public static final YearlyExtrema EMPTY = new YearlyExtrema(0.0, null, 0.0, null, 0.0);

    public static YearlyExtrema of(List<DailyQuote> window) {
        double max = 0.0;
        double min = 0.0;
        LocalDate maxDate = null;
        LocalDate minDate = null;
        double sum = 0.0;
        int count = 0;

        for (DailyQuote quote : window) {
            double close = quote.getClosingPrice() == null ? 0.0 : quote.getClosingPrice();
            if (close <= 0) {
                continue;
            }
            LocalDate date = quote.getDate();
            if (maxDate == null || close > max || (close == max && date.isBefore(maxDate))) {
                max = close;
                maxDate = date;
            }
            if (minDate == null || close < min || (close == min && date.isBefore(minDate))) {
                min = close;
                minDate = date;
            }
            sum += close;
            count++;
        }

        if (count == 0) {
            return EMPTY;
        }
        return new YearlyExtrema(max, maxDate, min, minDate, sum / count);
    }

    public void applyTo(DailyQuote target) {
        target.setMaximumPriceInYear(maximum);
        target.setMaximumPriceInYearDateOn(maximumDate);
        target.setMinimumPriceInYear(minimum);
        target.setMinimumPriceInYearDateOn(minimumDate);
        target.setAveragePriceInYear(average);
    }
}
