package tw.gc.stock.crawler.services.scheduling;

import tw.gc.stock.crawler.entities.JobExecution;
import tw.gc.stock.crawler.services.fetch.FetchReport;
import tw.gc.stock.crawler.services.merge.MergeReport;

/**
 * Counters a job hands back to the runner.
 *
 * @param fetched items fetched successfully
 * @param merged  records written or confirmed unchanged
 * @param failed  failed fetch items plus rejected or conflicting records
 */
public record JobOutcome(int fetched, int merged, int failed, boolean skipped, String message) {

    public static JobOutcome skipped(String reason) {
        return new JobOutcome(0, 0, 0, true, reason);
    }

    public static JobOutcome of(FetchReport fetch, MergeReport merge) {
        return new JobOutcome(
                fetch.succeededItems(),
                merge.applied() + merge.unchanged(),
                fetch.failedItems() + merge.failed(),
                false,
                String.format("%s: %d items ok, %d failed; %d applied, %d unchanged, %d rejected, %d conflicts",
                        fetch.sourceName(), fetch.succeededItems(), fetch.failedItems(),
                        merge.applied(), merge.unchanged(), merge.rejected().size(), merge.conflicts()));
    }

    public JobOutcome plus(JobOutcome other) {
        String joined = message == null || message.isEmpty() ? other.message()
                : other.message() == null || other.message().isEmpty() ? message
                : message + "\n" + other.message();
        return new JobOutcome(fetched + other.fetched(), merged + other.merged(), failed + other.failed(),
                skipped && other.skipped(), joined);
    }

    public JobExecution.Status status() {
        if (skipped) {
            return JobExecution.Status.SKIPPED;
        }
        if (failed == 0) {
            return JobExecution.Status.SUCCEEDED;
        }
        return fetched > 0 || merged > 0 ? JobExecution.Status.PARTIAL : JobExecution.Status.FAILED;
    }
}
