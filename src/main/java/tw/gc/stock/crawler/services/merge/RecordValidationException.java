package tw.gc.stock.crawler.services.merge;

/**
 * A record cannot be merged as delivered (missing or malformed natural key).
 * Retrying the same record never helps.
 */
public class RecordValidationException extends RuntimeException {

    private final String recordKey;

    public RecordValidationException(String recordKey, String message) {
        super(message);
        this.recordKey = recordKey;
    }

    public String getRecordKey() {
        return recordKey;
    }
}
