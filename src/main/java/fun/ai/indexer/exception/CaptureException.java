package fun.ai.indexer.exception;

/**
 * 单个预览截图失败（由预览队列按 item 捕获，不会中断整个批次）。
 */
public class CaptureException extends IndexerException {

    private static final String ERROR_CODE = "CAPTURE_ERR";

    public CaptureException(String message) {
        super(ERROR_CODE, message);
    }

    public CaptureException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
