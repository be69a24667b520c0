package alertthreader.web;

/**
 * 请求体无法处理, 整个批次被拒绝
 */
public class InvalidAlertBatchException extends RuntimeException {
    public InvalidAlertBatchException(String message) {
        super(message);
    }

    public InvalidAlertBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
