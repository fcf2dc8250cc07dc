package tw.gc.stock.crawler.sources.records;

/**
 * A source-agnostic record ready to be merged into the canonical store.
 *
 * <p>Fields left {@code null} mean "not provided by this source" and never
 * overwrite stored values.</p>
 */
public interface NormalizedRecord {

    RecordKind kind();

    /**
     * Human readable natural key, used in reports and logs.
     */
    String naturalKey();

    /**
     * Security the record belongs to, or {@code null} for market-wide records.
     */
    String securityCode();
}
