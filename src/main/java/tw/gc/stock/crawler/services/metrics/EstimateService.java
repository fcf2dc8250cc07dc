package tw.gc.stock.crawler.services.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.stock.crawler.config.CrawlerProperties;
import tw.gc.stock.crawler.entities.DailyQuote;
import tw.gc.stock.crawler.entities.Dividend;
import tw.gc.stock.crawler.entities.Estimate;
import tw.gc.stock.crawler.entities.FinancialStatement;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.repositories.DailyQuoteRepository;
import tw.gc.stock.crawler.repositories.DividendRepository;
import tw.gc.stock.crawler.repositories.EstimateRepository;
import tw.gc.stock.crawler.repositories.FinancialStatementRepository;
import tw.gc.stock.crawler.repositories.StockRepository;
import tw.gc.stock.crawler.services.SecurityLockRegistry;
import tw.gc.stock.crawler.services.metrics.ValuationEstimator.Band;
import tw.gc.stock.crawler.services.metrics.ValuationEstimator.Valuation;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Daily valuation bands per security.
 *
 * <p>History is read over {@code crawler.estimate.lookback-years} calendar
 * years ending with the valuation date's year. One {@code estimate} row per
 * (security, date), overwritten on rerun.</p>
 */
@Service
@Slf4j
public class EstimateService {

    private final StockRepository stockRepository;
    private final DailyQuoteRepository dailyQuoteRepository;
    private final DividendRepository dividendRepository;
    private final FinancialStatementRepository financialStatementRepository;
    private final EstimateRepository estimateRepository;
    private final SecurityLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;
    private final ValuationEstimator estimator;
    private final int lookbackYears;

    public record EstimateReport(int computed, int skipped, int failed) {}

    public EstimateService(StockRepository stockRepository,
                           DailyQuoteRepository dailyQuoteRepository,
                           DividendRepository dividendRepository,
                           FinancialStatementRepository financialStatementRepository,
                           EstimateRepository estimateRepository,
                           SecurityLockRegistry lockRegistry,
                           PlatformTransactionManager transactionManager,
                           CrawlerProperties properties) {
        this.stockRepository = stockRepository;
        this.dailyQuoteRepository = dailyQuoteRepository;
        this.dividendRepository = dividendRepository;
        this.financialStatementRepository = financialStatementRepository;
        this.estimateRepository = estimateRepository;
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.estimator = new ValuationEstimator(properties.getEstimate().getDefaultPayoutRatio());
        this.lookbackYears = Math.max(1, properties.getEstimate().getLookbackYears());
    }

    // ========== Public API ==========

    public EstimateReport computeForDate(LocalDate date) {
        int computed = 0;
        int skipped = 0;
        int failed = 0;

        for (Stock stock : stockRepository.findBySuspendListingFalseOrderByStockSymbolAsc()) {
            String code = stock.getStockSymbol();
            try {
                if (computeSecurity(code, date).isPresent()) {
                    computed++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.error("❌ Estimate failed for {} on {}", code, date, e);
                failed++;
            }
        }

        log.info("💰 Valuation bands for {}: {} computed, {} skipped, {} failed", date, computed, skipped, failed);
        return new EstimateReport(computed, skipped, failed);
    }

    /**
     * @return the stored band, empty when the security has no quote on {@code date}
     */
    public Optional<Estimate> computeSecurity(String code, LocalDate date) {
        return lockRegistry.withLock(code, () -> Optional.ofNullable(
                transactionTemplate.execute(status -> recompute(code, date))));
    }

    @Transactional(readOnly = true)
    public Optional<Estimate> getLatest(String code) {
        return estimateRepository.findFirstBySecurityCodeOrderByDateDesc(code);
    }

    // ========== Computation ==========

    private Estimate recompute(String code, LocalDate date) {
        Optional<DailyQuote> quote = dailyQuoteRepository.findBySecurityCodeAndDate(code, date);
        if (quote.isEmpty() || quote.get().getClosingPrice() <= 0) {
            log.debug("No traded quote for {} on {}, band skipped", code, date);
            return null;
        }
        Optional<Stock> stock = stockRepository.findById(code);

        int toYear = date.getYear();
        int fromYear = toYear - lookbackYears + 1;
        List<DailyQuote> history = dailyQuoteRepository.findBySecurityCodeAndDateBetweenOrderByDateAsc(
                code, LocalDate.of(fromYear, 1, 1), date);
        List<DailyQuote> traded = history.stream()
                .filter(q -> q.getClosingPrice() > 0)
                .toList();
        List<Dividend> dividends = dividendRepository.findBySecurityCodeAndYearBetweenOrderByYearAscQuarterAsc(
                code, fromYear, toYear);
        List<FinancialStatement> quarters = financialStatementRepository.findQuartersBetween(code, fromYear, toYear);

        ValuationEstimator.Inputs inputs = new ValuationEstimator.Inputs(
                quote.get().getClosingPrice(),
                traded.stream().map(DailyQuote::getClosingPrice).toList(),
                annualDividends(dividends),
                dividends.stream().map(Dividend::getPayoutRatio).toList(),
                stock.map(Stock::getLastFourEps).orElse(0.0),
                traded.stream().map(DailyQuote::getPriceToBookRatio).toList(),
                stock.map(Stock::getNetAssetValuePerShare).orElse(0.0),
                traded.stream().map(DailyQuote::getPriceEarningRatio).toList(),
                annualEps(quarters),
                (int) traded.stream().map(q -> q.getDate().getYear()).distinct().count());

        Valuation valuation = estimator.estimate(inputs);

        Estimate estimate = estimateRepository.findBySecurityCodeAndDate(code, date)
                .orElseGet(() -> Estimate.builder().securityCode(code).date(date).build());
        apply(estimate, quote.get().getClosingPrice(), valuation);
        return estimateRepository.save(estimate);
    }

    static Map<Integer, Double> annualDividends(List<Dividend> dividends) {
        Map<Integer, Double> byYear = new TreeMap<>();
        AnnualDividends.byYear(dividends).forEach((year, annual) -> byYear.put(year, annual.total()));
        return byYear;
    }

    /**
     * Year to the sum of that year's quarterly EPS.
     */
    static Map<Integer, Double> annualEps(List<FinancialStatement> quarters) {
        return quarters.stream()
                .collect(Collectors.groupingBy(FinancialStatement::getYear, TreeMap::new,
                        Collectors.summingDouble(FinancialStatement::getEarningsPerShare)));
    }

    private static void apply(Estimate target, double closingPrice, Valuation valuation) {
        target.setClosingPrice(closingPrice);
        target.setPercentage(valuation.percentage());
        target.setYearCount(valuation.yearCount());

        Band blended = valuation.blended();
        target.setCheap(blended.cheap());
        target.setFair(blended.fair());
        target.setExpensive(blended.expensive());

        target.setPriceCheap(valuation.price().cheap());
        target.setPriceFair(valuation.price().fair());
        target.setPriceExpensive(valuation.price().expensive());
        target.setDividendCheap(valuation.dividend().cheap());
        target.setDividendFair(valuation.dividend().fair());
        target.setDividendExpensive(valuation.dividend().expensive());
        target.setEpsCheap(valuation.eps().cheap());
        target.setEpsFair(valuation.eps().fair());
        target.setEpsExpensive(valuation.eps().expensive());
        target.setPbrCheap(valuation.pbr().cheap());
        target.setPbrFair(valuation.pbr().fair());
        target.setPbrExpensive(valuation.pbr().expensive());
        target.setPerCheap(valuation.per().cheap());
        target.setPerFair(valuation.per().fair());
        target.setPerExpensive(valuation.per().expensive());
    }
}
