package xyz.firestige.redis.taskindex.exception;

/**
 * 任务索引基础异常
 *
 * <p>所有对外暴露的错误都是它的子类，调用方通过 {@link #getKind()} 决定如何响应，
 * 不会看到任何存储客户端特有的异常类型。
 *
 * @since 1.0
 */
public abstract class TaskIndexException extends RuntimeException {

    private final ErrorKind kind;

    protected TaskIndexException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TaskIndexException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
