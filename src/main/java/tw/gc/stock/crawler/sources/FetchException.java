package tw.gc.stock.crawler.sources;

/**
 * A source could not deliver records for a target: network failure, timeout
 * or unparseable payload. Always worth retrying.
 */
public class FetchException extends Exception {

    private final FetchTarget target;

    public FetchException(FetchTarget target, String message) {
        super(message);
        this.target = target;
    }

    public FetchException(FetchTarget target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public FetchTarget getTarget() {
        return target;
    }
}
