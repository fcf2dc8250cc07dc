package tw.gc.stock.crawler.services.merge;

/**
 * The store refused a write, typically a unique constraint hit by a
 * concurrent writer of the same natural key.
 */
public class ConflictException extends RuntimeException {

    private final String recordKey;

    public ConflictException(String recordKey, Throwable cause) {
        super("Store conflict on " + recordKey + ": " + cause.getMessage(), cause);
        this.recordKey = recordKey;
    }

    public String getRecordKey() {
        return recordKey;
    }
}
