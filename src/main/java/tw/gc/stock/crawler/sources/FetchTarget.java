package tw.gc.stock.crawler.sources;

/**
 * One unit of work for a source: a security code, a market id or a period,
 * depending on what the source is keyed by.
 */
public record FetchTarget(String sourceName, String key) {

    @Override
    public String toString() {
        return sourceName + ":" + key;
    }
}
