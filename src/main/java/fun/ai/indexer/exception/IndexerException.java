package fun.ai.indexer.exception;

/**
 * indexer 领域异常基类：携带 errorCode，便于接口层映射与排查。
 */
public class IndexerException extends RuntimeException {

    private final String errorCode;

    public IndexerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public IndexerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
