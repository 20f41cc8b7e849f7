package xyz.firestige.redis.taskindex.api;

import java.util.List;

/**
 * 查询引擎
 *
 * <p>读操作不要求彼此原子，可能读到稍旧的快照。
 *
 * @since 1.0
 */
public interface TaskQueryEngine {

    /**
     * 按过滤条件列出任务
     *
     * <p>活跃部分按创建时间倒序，已删除部分按删除时间倒序，两部分不会交错。
     * 索引中存在但记录缺失、或 owner 不匹配的 id 被静默跳过。
     *
     * @param ownerId owner id
     * @param filter 过滤条件
     * @return 任务列表
     * @throws xyz.firestige.redis.taskindex.exception.TaskValidationException 过滤条件不合法
     */
    List<Task> list(String ownerId, TaskFilter filter);

    /**
     * 获取单个任务（含已删除）
     *
     * @param ownerId owner id
     * @param taskId 任务 id
     * @return 任务
     * @throws xyz.firestige.redis.taskindex.exception.TaskNotFoundException 不存在或不属于该 owner
     */
    Task get(String ownerId, String taskId);

    /**
     * 列出 owner 使用过的分类
     *
     * @param ownerId owner id
     * @return 非空分类名，升序
     */
    List<String> categories(String ownerId);
}
