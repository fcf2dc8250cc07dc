package tw.gc.stock.crawler.services.scheduling;

import lombok.extern.slf4j.Slf4j;
import tw.gc.stock.crawler.services.TaiwanMarketCalendar;
import tw.gc.stock.crawler.services.merge.QuoteGapFiller;
import tw.gc.stock.crawler.services.merge.QuoteGapFiller.FillReport;
import tw.gc.stock.crawler.services.metrics.EstimateService;
import tw.gc.stock.crawler.services.metrics.EstimateService.EstimateReport;
import tw.gc.stock.crawler.services.metrics.MetricsEngineService;
import tw.gc.stock.crawler.services.metrics.MetricsEngineService.MetricsReport;
import tw.gc.stock.crawler.services.metrics.YieldRankService;
import tw.gc.stock.crawler.services.metrics.YieldRankService.YieldReport;
import tw.gc.stock.crawler.services.portfolio.PortfolioSnapshotService;
import tw.gc.stock.crawler.services.portfolio.PortfolioSnapshotService.SnapshotReport;

import java.time.LocalDate;
import java.util.List;

/**
 * After-close aggregation of a trading day.
 *
 * <h3>Stages, in order:</h3>
 * <ol>
 *   <li>Daily quotes and market indices</li>
 *   <li>Quote gaps of active securities, copied from their last quote</li>
 *   <li>Quote metrics (moving averages, yearly extremes, price-to-book)</li>
 *   <li>Valuation bands</li>
 *   <li>Dividend yields</li>
 *   <li>Portfolio snapshots</li>
 * </ol>
 *
 * Non-trading days are skipped.
 */
@Slf4j
public class ClosingJob implements PipelineJob {

    public static final String NAME = "closing";

    private final List<SourceRefreshJob> fetchStages;
    private final TaiwanMarketCalendar marketCalendar;
    private final QuoteGapFiller quoteGapFiller;
    private final MetricsEngineService metricsEngineService;
    private final EstimateService estimateService;
    private final YieldRankService yieldRankService;
    private final PortfolioSnapshotService portfolioSnapshotService;

    public ClosingJob(List<SourceRefreshJob> fetchStages,
                      TaiwanMarketCalendar marketCalendar,
                      QuoteGapFiller quoteGapFiller,
                      MetricsEngineService metricsEngineService,
                      EstimateService estimateService,
                      YieldRankService yieldRankService,
                      PortfolioSnapshotService portfolioSnapshotService) {
        this.fetchStages = List.copyOf(fetchStages);
        this.marketCalendar = marketCalendar;
        this.quoteGapFiller = quoteGapFiller;
        this.metricsEngineService = metricsEngineService;
        this.estimateService = estimateService;
        this.yieldRankService = yieldRankService;
        this.portfolioSnapshotService = portfolioSnapshotService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JobOutcome run(LocalDate businessDate) {
        if (!marketCalendar.isTradingDay(businessDate)) {
            log.info("📅 {} is not a trading day, closing skipped", businessDate);
            return JobOutcome.skipped(businessDate + " is not a trading day");
        }

        JobOutcome outcome = new JobOutcome(0, 0, 0, false, "");
        for (SourceRefreshJob stage : fetchStages) {
            outcome = outcome.plus(stage.run(businessDate));
        }

        FillReport gaps = quoteGapFiller.fill(businessDate);
        outcome = outcome.plus(stageOutcome(gaps.failed(),
                String.format("quote gaps: %d missing, %d filled, %d failed",
                        gaps.missing(), gaps.filled(), gaps.failed())));

        MetricsReport metrics = metricsEngineService.computeForDate(businessDate);
        outcome = outcome.plus(stageOutcome(metrics.failed(),
                String.format("metrics: %d computed, %d skipped, %d failed",
                        metrics.computed(), metrics.skipped(), metrics.failed())));

        EstimateReport estimates = estimateService.computeForDate(businessDate);
        outcome = outcome.plus(stageOutcome(estimates.failed(),
                String.format("estimates: %d computed, %d skipped, %d failed",
                        estimates.computed(), estimates.skipped(), estimates.failed())));

        YieldReport yields = yieldRankService.computeForDate(businessDate);
        outcome = outcome.plus(stageOutcome(yields.failed(),
                String.format("yield rank: %d stored, %d skipped, %d failed",
                        yields.ranked(), yields.skipped(), yields.failed())));

        SnapshotReport snapshot = portfolioSnapshotService.snapshot(businessDate);
        outcome = outcome.plus(stageOutcome(snapshot.failed(),
                String.format("portfolio: %d members, %d positions, %d failed",
                        snapshot.members(), snapshot.securities(), snapshot.failed())));

        return outcome;
    }

    private static JobOutcome stageOutcome(int failed, String message) {
        return new JobOutcome(0, 0, failed, false, message);
    }
}
