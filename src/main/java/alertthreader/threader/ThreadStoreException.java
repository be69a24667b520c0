package alertthreader.threader;

/**
 * 线程存储异常 - 远程不可达或本地磁盘不可写
 */
public class ThreadStoreException extends RuntimeException {
    public ThreadStoreException(String message) {
        super(message);
    }

    public ThreadStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
