package tw.gc.stock.crawler.services.fetch;

import tw.gc.stock.crawler.sources.FetchTarget;
import tw.gc.stock.crawler.sources.records.NormalizedRecord;

import java.util.List;

/**
 * Post-processes the records of one successfully fetched item, e.g. to stamp a
 * date the source leaves out or to drop rows outside the batch.
 */
@FunctionalInterface
public interface RecordHandler {

    RecordHandler IDENTITY = (target, records) -> records;

    List<NormalizedRecord> handle(FetchTarget target, List<NormalizedRecord> records);
}
