package xyz.firestige.redis.taskindex.exception;

/**
 * 状态冲突
 *
 * <p>例如恢复一个未删除的任务、重命名为相同名称。
 *
 * @since 1.0
 */
public class TaskConflictException extends TaskIndexException {

    public TaskConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
