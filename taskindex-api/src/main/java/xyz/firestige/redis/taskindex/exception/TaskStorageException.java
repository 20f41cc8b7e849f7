package xyz.firestige.redis.taskindex.exception;

/**
 * 存储异常
 *
 * <p>原子批次未能提交或读取失败。本层不做重试，重试策略由调用方决定。
 *
 * @since 1.0
 */
public class TaskStorageException extends TaskIndexException {

    public TaskStorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    public TaskStorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
