package tw.gc.stock.crawler.sources;

import tw.gc.stock.crawler.sources.records.NormalizedRecord;

import java.util.List;

/**
 * Capability of one external data source: turn a target into normalized
 * records. All site-specific parsing lives behind this interface, the
 * pipeline only ever sees {@link NormalizedRecord}s.
 */
public interface SourceAdapter {

    /**
     * Unique source name, referenced by jobs (e.g., "listed-quotes").
     */
    String name();

    List<NormalizedRecord> fetch(FetchTarget target) throws FetchException;
}
