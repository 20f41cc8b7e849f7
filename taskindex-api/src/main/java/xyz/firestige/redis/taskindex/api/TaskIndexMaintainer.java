package xyz.firestige.redis.taskindex.api;

/**
 * 索引维护器
 *
 * <p>负责所有写操作。每个操作都以单个原子批次同时更新任务记录和全部二级结构：
 * active-set、active-order、categories、category-members、deleted-order。
 *
 * <p>所有方法都带 owner id；任务属于其他 owner 时按不存在处理。
 *
 * @since 1.0
 */
public interface TaskIndexMaintainer {

    /**
     * 创建任务
     *
     * @param task 已通过校验的任务
     * @throws xyz.firestige.redis.taskindex.exception.TaskValidationException 任务不合法
     * @throws xyz.firestige.redis.taskindex.exception.TaskStorageException 批次提交失败
     */
    void create(Task task);

    /**
     * 更新完成状态
     *
     * <p>只修改任务记录，不涉及任何索引结构。
     *
     * @param ownerId owner id
     * @param taskId 任务 id
     * @param completed 完成状态
     */
    void setCompletion(String ownerId, String taskId, boolean completed);

    /**
     * 软删除
     *
     * <p>categories(owner) 保持不变，即便这是该分类最后一个活跃任务。
     *
     * @param ownerId owner id
     * @param taskId 任务 id
     * @throws xyz.firestige.redis.taskindex.exception.TaskConflictException 任务已删除
     */
    void softDelete(String ownerId, String taskId);

    /**
     * 恢复软删除的任务
     *
     * <p>active-order 的分数恢复为原始创建时间。恢复窗口由调用方判断，这里不做检查。
     *
     * @param ownerId owner id
     * @param taskId 任务 id
     * @throws xyz.firestige.redis.taskindex.exception.TaskConflictException 任务未删除
     */
    void restore(String ownerId, String taskId);

    /**
     * 重命名分类
     *
     * <p>新名称已存在时合并两个成员集合。
     *
     * <p>原名称不在 categories(owner) 中时：若新名称已存在，视为重复执行的重命名，抛出冲突；
     * 否则抛出不存在。categories(owner) 不保留历史，拼错的原名称恰好配上已存在的新名称时
     * 同样得到冲突。
     *
     * @param ownerId owner id
     * @param oldName 原名称
     * @param newName 新名称
     * @throws xyz.firestige.redis.taskindex.exception.TaskConflictException 新旧名称相同，或原名称不存在而新名称已存在
     * @throws xyz.firestige.redis.taskindex.exception.TaskNotFoundException 原名称与新名称都不存在
     */
    void renameCategory(String ownerId, String oldName, String newName);

    /**
     * 删除分类
     *
     * <p>只清空相关任务的分类字段，不删除任务。
     *
     * @param ownerId owner id
     * @param name 分类名称
     */
    void deleteCategory(String ownerId, String name);
}
