package xyz.firestige.redis.taskindex.exception;

/**
 * 任务或分类不存在
 *
 * <p>任务属于其他 owner 时同样抛出此异常，消息内容与真正不存在时完全一致。
 *
 * @since 1.0
 */
public class TaskNotFoundException extends TaskIndexException {

    public TaskNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static TaskNotFoundException task(String taskId) {
        return new TaskNotFoundException("task not found: " + taskId);
    }

    public static TaskNotFoundException category(String name) {
        return new TaskNotFoundException("category not found: " + name);
    }
}
