package tw.gc.stock.crawler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.stock.crawler.AppConstants;
import tw.gc.stock.crawler.entities.Stock;
import tw.gc.stock.crawler.repositories.StockRepository;
import tw.gc.stock.crawler.services.TaiwanMarketCalendar;
import tw.gc.stock.crawler.services.fetch.FetchOrchestrator;
import tw.gc.stock.crawler.services.fetch.RecordHandler;
import tw.gc.stock.crawler.services.merge.QuoteGapFiller;
import tw.gc.stock.crawler.services.merge.UpsertMerger;
import tw.gc.stock.crawler.services.metrics.EstimateService;
import tw.gc.stock.crawler.services.metrics.MetricsEngineService;
import tw.gc.stock.crawler.services.metrics.YieldRankService;
import tw.gc.stock.crawler.services.portfolio.PortfolioSnapshotService;
import tw.gc.stock.crawler.services.scheduling.ClosingJob;
import tw.gc.stock.crawler.services.scheduling.PipelineJob;
import tw.gc.stock.crawler.services.scheduling.ScheduleTimetable;
import tw.gc.stock.crawler.services.scheduling.SourceRefreshJob;
import tw.gc.stock.crawler.sources.records.NormalizedRecord;
import tw.gc.stock.crawler.sources.records.QuoteRecord;
import tw.gc.stock.crawler.sources.records.StockIndexRecord;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Function;

/**
 * The named jobs of the daily timetable and the sources each one reads.
 *
 * <h3>Fetch keys:</h3>
 * <ul>
 *   <li>per security - payout ratio, dividend, emerging book value</li>
 *   <li>per market - security list</li>
 *   <li>per period - financial statements, revenue</li>
 *   <li>per date - quotes, indices, index weights, foreign holdings</li>
 * </ul>
 */
@Configuration
public class PipelineJobsConfig {

    public static final String SOURCE_EMERGING_NET_ASSET_VALUE = "emerging-net-asset-value";
    public static final String SOURCE_PAYOUT_RATIO = "payout-ratio";
    public static final String SOURCE_QUARTERLY_FINANCIALS = "quarterly-financials";
    public static final String SOURCE_ANNUAL_FINANCIALS = "annual-financials";
    public static final String SOURCE_REVENUE = "revenue";
    public static final String SOURCE_SECURITY_LIST = "security-list";
    public static final String SOURCE_STOCK_WEIGHT = "stock-weight";
    public static final String SOURCE_DIVIDEND = "dividend";
    public static final String SOURCE_FOREIGN_HOLDINGS = "foreign-holdings";
    public static final String SOURCE_LISTED_QUOTES = "listed-quotes";
    public static final String SOURCE_OTC_QUOTES = "otc-quotes";
    public static final String SOURCE_STOCK_INDEX = "stock-index";

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyyMM");

    private final FetchOrchestrator fetchOrchestrator;
    private final UpsertMerger upsertMerger;
    private final StockRepository stockRepository;

    public PipelineJobsConfig(FetchOrchestrator fetchOrchestrator, UpsertMerger upsertMerger,
                              StockRepository stockRepository) {
        this.fetchOrchestrator = fetchOrchestrator;
        this.upsertMerger = upsertMerger;
        this.stockRepository = stockRepository;
    }

    @Bean
    public ScheduleTimetable scheduleTimetable(CrawlerProperties properties) {
        return ScheduleTimetable.from(properties.getSchedule());
    }

    // ========== Night Refreshes ==========

    @Bean
    public PipelineJob refreshEmergingNetAssetValueJob() {
        return refresh("refresh-emerging-net-asset-value", SOURCE_EMERGING_NET_ASSET_VALUE,
                date -> codes(stockRepository.findByStockExchangeMarketIdAndSuspendListingFalseOrderByStockSymbolAsc(
                        AppConstants.MARKET_EMERGING)));
    }

    @Bean
    public PipelineJob refreshPayoutRatioJob() {
        return refresh("refresh-payout-ratio", SOURCE_PAYOUT_RATIO, date -> activeCodes());
    }

    @Bean
    public PipelineJob refreshQuarterlyFinancialsJob() {
        return refresh("refresh-quarterly-financials", SOURCE_QUARTERLY_FINANCIALS,
                date -> List.of(previousQuarter(date)));
    }

    @Bean
    public PipelineJob refreshAnnualFinancialsJob() {
        return refresh("refresh-annual-financials", SOURCE_ANNUAL_FINANCIALS,
                date -> List.of(String.valueOf(date.getYear() - 1)));
    }

    @Bean
    public PipelineJob refreshRevenueJob() {
        return refresh("refresh-revenue", SOURCE_REVENUE,
                date -> List.of(date.minusMonths(1).format(MONTH_KEY)));
    }

    @Bean
    public PipelineJob refreshSecurityListJob() {
        return refresh("refresh-security-list", SOURCE_SECURITY_LIST, date -> List.of(
                String.valueOf(AppConstants.MARKET_LISTED),
                String.valueOf(AppConstants.MARKET_OVER_THE_COUNTER),
                String.valueOf(AppConstants.MARKET_EMERGING)));
    }

    @Bean
    public PipelineJob refreshStockWeightJob() {
        return refresh("refresh-stock-weight", SOURCE_STOCK_WEIGHT, date -> List.of(date.toString()));
    }

    // ========== Evening Refreshes ==========

    @Bean
    public PipelineJob refreshDividendJob() {
        return refresh("refresh-dividend", SOURCE_DIVIDEND, date -> activeCodes());
    }

    @Bean
    public PipelineJob refreshForeignHoldingsJob() {
        return refresh("refresh-foreign-holdings", SOURCE_FOREIGN_HOLDINGS, date -> List.of(date.toString()));
    }

    // ========== Closing ==========

    @Bean
    public PipelineJob closingJob(TaiwanMarketCalendar marketCalendar,
                                  QuoteGapFiller quoteGapFiller,
                                  MetricsEngineService metricsEngineService,
                                  EstimateService estimateService,
                                  YieldRankService yieldRankService,
                                  PortfolioSnapshotService portfolioSnapshotService) {
        List<SourceRefreshJob> fetchStages = List.of(
                new SourceRefreshJob("closing-listed-quotes", SOURCE_LISTED_QUOTES,
                        date -> List.of(date.toString()), PipelineJobsConfig::stampBusinessDate,
                        fetchOrchestrator, upsertMerger),
                new SourceRefreshJob("closing-otc-quotes", SOURCE_OTC_QUOTES,
                        date -> List.of(date.toString()), PipelineJobsConfig::stampBusinessDate,
                        fetchOrchestrator, upsertMerger),
                new SourceRefreshJob("closing-stock-index", SOURCE_STOCK_INDEX,
                        date -> List.of(date.toString()), PipelineJobsConfig::stampBusinessDate,
                        fetchOrchestrator, upsertMerger));
        return new ClosingJob(fetchStages, marketCalendar, quoteGapFiller, metricsEngineService, estimateService,
                yieldRankService, portfolioSnapshotService);
    }

    // ========== Helpers ==========

    private SourceRefreshJob refresh(String name, String source,
                                     Function<LocalDate, List<String>> targets) {
        return new SourceRefreshJob(name, source, targets, fetchOrchestrator, upsertMerger);
    }

    private List<String> activeCodes() {
        return codes(stockRepository.findBySuspendListingFalseOrderByStockSymbolAsc());
    }

    private static List<String> codes(List<Stock> stocks) {
        return stocks.stream().map(Stock::getStockSymbol).toList();
    }

    /**
     * Latest quarter that has fully ended before {@code date}, as {@code yyyyQn}.
     */
    static String previousQuarter(LocalDate date) {
        int quarter = (date.getMonthValue() - 1) / 3;
        return quarter == 0
                ? (date.getYear() - 1) + "Q4"
                : date.getYear() + "Q" + quarter;
    }

    /**
     * Day-end sources often leave the trade date out of their rows.
     */
    static RecordHandler stampBusinessDate(LocalDate date) {
        return (target, records) -> records.stream()
                .map(record -> withDate(record, date))
                .toList();
    }

    private static NormalizedRecord withDate(NormalizedRecord record, LocalDate date) {
        if (record instanceof QuoteRecord quote && quote.date() == null) {
            return quote.toBuilder().date(date).build();
        }
        if (record instanceof StockIndexRecord index && index.date() == null) {
            return index.toBuilder().date(date).build();
        }
        return record;
    }
}
