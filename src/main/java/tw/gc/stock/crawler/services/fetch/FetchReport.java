package tw.gc.stock.crawler.services.fetch;

import tw.gc.stock.crawler.sources.records.NormalizedRecord;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a fetch batch, partitioned into the records of the items that
 * succeeded and the items that ran out of attempts.
 */
public record FetchReport(
        String sourceName,
        List<NormalizedRecord> records,
        List<FailedItem> failures,
        int succeededItems,
        Duration elapsed
) {

    public int failedItems() {
        return failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
