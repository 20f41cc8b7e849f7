/**
 * 任务索引异常类型
 * <p>
 * 四类错误，均为非受检异常：
 * <ul>
 *   <li>{@link xyz.firestige.redis.taskindex.exception.TaskValidationException} - 输入不合法</li>
 *   <li>{@link xyz.firestige.redis.taskindex.exception.TaskNotFoundException} - 不存在或无权访问</li>
 *   <li>{@link xyz.firestige.redis.taskindex.exception.TaskConflictException} - 状态冲突</li>
 *   <li>{@link xyz.firestige.redis.taskindex.exception.TaskStorageException} - 存储失败</li>
 * </ul>
 *
 * @since 1.0
 */
package xyz.firestige.redis.taskindex.exception;
