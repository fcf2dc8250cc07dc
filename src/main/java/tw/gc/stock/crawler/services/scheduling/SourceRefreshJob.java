package tw.gc.stock.crawler.services.scheduling;

import lombok.extern.slf4j.Slf4j;
import tw.gc.stock.crawler.services.fetch.FetchJob;
import tw.gc.stock.crawler.services.fetch.FetchOrchestrator;
import tw.gc.stock.crawler.services.fetch.FetchReport;
import tw.gc.stock.crawler.services.fetch.RecordHandler;
import tw.gc.stock.crawler.services.merge.MergeReport;
import tw.gc.stock.crawler.services.merge.UpsertMerger;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Fetch one source for a set of keys derived from the business date, then
 * merge everything that came back.
 */
@Slf4j
public class SourceRefreshJob implements PipelineJob {

    private final String name;
    private final String sourceName;
    private final Function<LocalDate, List<String>> targets;
    private final Function<LocalDate, RecordHandler> handler;
    private final FetchOrchestrator fetchOrchestrator;
    private final UpsertMerger upsertMerger;

    public SourceRefreshJob(String name, String sourceName, Function<LocalDate, List<String>> targets,
                            FetchOrchestrator fetchOrchestrator, UpsertMerger upsertMerger) {
        this(name, sourceName, targets, date -> RecordHandler.IDENTITY, fetchOrchestrator, upsertMerger);
    }

    public SourceRefreshJob(String name, String sourceName, Function<LocalDate, List<String>> targets,
                            Function<LocalDate, RecordHandler> handler,
                            FetchOrchestrator fetchOrchestrator, UpsertMerger upsertMerger) {
        this.name = name;
        this.sourceName = sourceName;
        this.targets = targets;
        this.handler = handler;
        this.fetchOrchestrator = fetchOrchestrator;
        this.upsertMerger = upsertMerger;
    }

    @Override
    public String name() {
        return name;
    }

    public String sourceName() {
        return sourceName;
    }

    @Override
    public JobOutcome run(LocalDate businessDate) {
        List<String> keys = targets.apply(businessDate);
        if (keys.isEmpty()) {
            log.info("Nothing to fetch from {} for {}", sourceName, businessDate);
            return new JobOutcome(0, 0, 0, false, sourceName + ": no targets");
        }

        FetchJob job = FetchJob.of(sourceName, keys).withHandler(handler.apply(businessDate));
        FetchReport fetched = fetchOrchestrator.execute(job);
        MergeReport merged = upsertMerger.merge(fetched.records());
        return JobOutcome.of(fetched, merged);
    }
}
