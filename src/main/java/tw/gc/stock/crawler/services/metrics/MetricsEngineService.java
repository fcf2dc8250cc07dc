package tw.gc.stock.crawler.services.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.QuoteHistoryRecord;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.repositories.DailyQuoteRepository;
import tw.gc.stock.crawler.repositories.QuoteHistoryRecordRepository;
import tw.gc.stock.crawler.repositories.StockRepository;
import tw.gc.stock.crawler.services.SecurityLockRegistry;
import tw.gc.stock.crawler.services.merge.MergeRules;
import tw.gc.stock.crawler.services.merge.MergeRules.Extreme;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes the derived columns of a day's quotes.
 *
 * <h3>Per security and date:</h3>
 * <ul>
 *   <li>Moving averages 5/10/20/60/120/240 over the rows up to the date</li>
 *   <li>Yearly high/low/average over the trailing 240 rows</li>
 *   <li>Price-to-book against the stock's current book value</li>
 *   <li>All-time extremes in {@code quote_history_record}</li>
 * </ul>
 *
 * Runs under the security's lock so the history read cannot interleave with a
 * merge of the same security. Recomputing is idempotent.
 */
@Service
@Slf4j
public class MetricsEngineService {

    private final DailyQuoteRepository dailyQuoteRepository;
    private final StockRepository stockRepository;
    private final QuoteHistoryRecordRepository quoteHistoryRecordRepository;
    private final SecurityLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;

    public record MetricsReport(int computed, int skipped, int failed) {}

    public MetricsEngineService(DailyQuoteRepository dailyQuoteRepository,
                                StockRepository stockRepository,
                                QuoteHistoryRecordRepository quoteHistoryRecordRepository,
                                SecurityLockRegistry lockRegistry,
                                PlatformTransactionManager transactionManager) {
        this.dailyQuoteRepository = dailyQuoteRepository;
        this.stockRepository = stockRepository;
        this.quoteHistoryRecordRepository = quoteHistoryRecordRepository;
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // ========== Public API ==========

    public MetricsReport computeForDate(LocalDate date) {
        List<String> codes = dailyQuoteRepository.findSecurityCodesByDate(date);
        int computed = 0;
        int skipped = 0;
        int failed = 0;

        for (String code : codes) {
            try {
                if (computeSecurity(code, date)) {
                    computed++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.error("❌ Metrics failed for {} on {}", code, date, e);
                failed++;
            }
        }

        log.info("📊 Quote metrics for {}: {} computed, {} skipped, {} failed", date, computed, skipped, failed);
        return new MetricsReport(computed, skipped, failed);
    }

    /**
     * @return false when the security has no quote on {@code date}
     */
    public boolean computeSecurity(String code, LocalDate date) {
        return lockRegistry.withLock(code, () -> Boolean.TRUE.equals(
                transactionTemplate.execute(status -> recompute(code, date))));
    }

    // ========== Computation ==========

    private boolean recompute(String code, LocalDate date) {
        Optional<DailyQuote> found = dailyQuoteRepository.findBySecurityCodeAndDate(code, date);
        if (found.isEmpty()) {
            log.debug("No quote for {} on {}, metrics skipped", code, date);
            return false;
        }
        DailyQuote quote = found.get();

        List<DailyQuote> history = dailyQuoteRepository.findBySecurityCodeAndDateLessThanEqualOrderByDateDesc(
                code, date, PageRequest.of(0, MovingAverages.MAX_WINDOW));
        List<Double> closes = history.stream()
                .map(DailyQuote::getClosingPrice)
                .toList();

        MovingAverages.apply(quote, closes);
        List<DailyQuote> yearWindow = history.subList(0, Math.min(YearlyExtrema.WINDOW, history.size()));
        YearlyExtrema.of(yearWindow).applyTo(quote);

        double netAssetValue = stockRepository.findById(code)
                .map(Stock::getNetAssetValuePerShare)
                .orElse(0.0);
        quote.setPriceToBookRatio(priceToBook(quote.getClosingPrice(), netAssetValue));

        dailyQuoteRepository.save(quote);
        updateHistoryRecord(code, quote);
        return true;
    }

    static double priceToBook(Double closingPrice, double netAssetValue) {
        if (closingPrice == null || closingPrice <= 0 || netAssetValue <= 0) {
            return 0.0;
        }
        return closingPrice / netAssetValue;
    }

    /**
     * Folds the quote into the all-time extremes. Intraday high/low feed the
     * price extremes, falling back to the close when the source left them out.
     */
    private void updateHistoryRecord(String code, DailyQuote quote) {
        QuoteHistoryRecord record = quoteHistoryRecordRepository.findById(code)
                .orElseGet(() -> QuoteHistoryRecord.builder().securityCode(code).build());
        LocalDate date = quote.getDate();
        double close = orZero(quote.getClosingPrice());
        double high = orZero(quote.getHighestPrice()) > 0 ? quote.getHighestPrice() : close;
        double low = orZero(quote.getLowestPrice()) > 0 ? quote.getLowestPrice() : close;

        Extreme maxPrice = MergeRules.improveHigh(
                Extreme.of(record.getMaximumPrice(), record.getMaximumPriceDateOn()), new Extreme(high, date));
        Extreme minPrice = MergeRules.improveLow(
                Extreme.of(record.getMinimumPrice(), record.getMinimumPriceDateOn()), new Extreme(low, date));
        Extreme maxPbr = MergeRules.improveHigh(
                Extreme.of(record.getMaximumPriceToBookRatio(), record.getMaximumPriceToBookRatioDateOn()),
                new Extreme(quote.getPriceToBookRatio(), date));
        Extreme minPbr = MergeRules.improveLow(
                Extreme.of(record.getMinimumPriceToBookRatio(), record.getMinimumPriceToBookRatioDateOn()),
                new Extreme(quote.getPriceToBookRatio(), date));

        record.setMaximumPrice(maxPrice.value());
        record.setMaximumPriceDateOn(maxPrice.date());
        record.setMinimumPrice(minPrice.value());
        record.setMinimumPriceDateOn(minPrice.date());
        record.setMaximumPriceToBookRatio(maxPbr.value());
        record.setMaximumPriceToBookRatioDateOn(maxPbr.date());
        record.setMinimumPriceToBookRatio(minPbr.value());
        record.setMinimumPriceToBookRatioDateOn(minPbr.date());
        quoteHistoryRecordRepository.save(record);
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
