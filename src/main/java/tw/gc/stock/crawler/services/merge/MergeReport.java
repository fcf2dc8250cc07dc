package tw.gc.stock.crawler.services.merge;

import java.util.List;

/**
 * Per-batch merge counters.
 *
 * @param applied   records that inserted a row or changed a stored field
 * @param unchanged records identical to what was already stored
 * @param rejected  records refused before touching the store
 * @param conflicts records whose write was refused by the store
 */
public record MergeReport(int applied, int unchanged, List<RejectedRecord> rejected, int conflicts) {

    public static final MergeReport EMPTY = new MergeReport(0, 0, List.of(), 0);

    public int total() {
        return applied + unchanged + rejected.size() + conflicts;
    }

    public int failed() {
        return rejected.size() + conflicts;
    }
}
