package xyz.firestige.redis.taskindex.api;

import java.util.List;

/**
 * 任务服务入口
 *
 * <p>传输层调用的门面。owner id 由认证层给出，这里不做认证；
 * 所有错误都以 {@link xyz.firestige.redis.taskindex.exception.TaskIndexException} 子类抛出。
 *
 * @since 1.0
 */
public interface TaskService {

    /**
     * 创建任务，描述和分类会去除首尾空白
     */
    Task createTask(String ownerId, String description, String category);

    Task getTask(String ownerId, String taskId);

    List<Task> listTasks(String ownerId, TaskFilter filter);

    /**
     * @return 更新后的任务
     */
    Task updateCompletion(String ownerId, String taskId, boolean completed);

    void deleteTask(String ownerId, String taskId);

    /**
     * 恢复任务，超过恢复窗口时抛出
     * {@link xyz.firestige.redis.taskindex.exception.TaskConflictException}
     *
     * @return 恢复后的任务
     */
    Task restoreTask(String ownerId, String taskId);

    List<String> listCategories(String ownerId);

    void renameCategory(String ownerId, String oldName, String newName);

    void deleteCategory(String ownerId, String name);
}
