package fun.ai.indexer.exception;

/**
 * Thrown when an executable entry cannot be started (missing file, spawn failure).
 */
public class AppLaunchException extends IndexerException {

    private static final String ERROR_CODE = "LAUNCH_ERR";

    public AppLaunchException(String message) {
        super(ERROR_CODE, message);
    }

    public AppLaunchException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
