package fun.ai.indexer.exception;

/**
 * Thrown when a static preview server cannot bind or never starts listening.
 */
public class StaticServerException extends IndexerException {

    private static final String ERROR_CODE = "STATIC_SERVER_ERR";

    public StaticServerException(String message) {
        super(ERROR_CODE, message);
    }

    public StaticServerException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
