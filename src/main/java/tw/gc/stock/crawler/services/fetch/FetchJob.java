package tw.gc.stock.crawler.services.fetch;

import tw.gc.stock.crawler.sources.FetchTarget;

import java.util.List;

/**
 * A batch of targets to fetch from one source.
 *
 * @param sourceName adapter to use
 * @param targets    keys to fetch, each one retried and reported on its own
 * @param handler    applied to the records of every successful item
 */
public record FetchJob(String sourceName, List<FetchTarget> targets, RecordHandler handler) {

    public FetchJob {
        targets = List.copyOf(targets);
        handler = handler == null ? RecordHandler.IDENTITY : handler;
    }

    public static FetchJob of(String sourceName, List<String> keys) {
        List<FetchTarget> targets = keys.stream()
                .map(key -> new FetchTarget(sourceName, key))
                .toList();
        return new FetchJob(sourceName, targets, RecordHandler.IDENTITY);
    }

    public FetchJob withHandler(RecordHandler next) {
        return new FetchJob(sourceName, targets, next);
    }
}
