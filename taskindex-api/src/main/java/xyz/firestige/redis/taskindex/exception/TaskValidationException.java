package xyz.firestige.redis.taskindex.exception;

/**
 * 输入校验失败
 *
 * <p>总是在访问存储之前抛出。
 *
 * @since 1.0
 */
public class TaskValidationException extends TaskIndexException {

    public TaskValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
