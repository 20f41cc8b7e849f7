/**
 * Redis 任务索引核心 API
 * <p>
 * 在只有 Hash、Set、ZSet 的键值存储上维护任务的多路访问结构。
 * 核心接口：
 * <ul>
 *   <li>{@link xyz.firestige.redis.taskindex.api.TaskService} - 服务入口</li>
 *   <li>{@link xyz.firestige.redis.taskindex.api.TaskIndexMaintainer} - 写路径，原子批次维护索引</li>
 *   <li>{@link xyz.firestige.redis.taskindex.api.TaskQueryEngine} - 读路径，过滤、分页、水合</li>
 *   <li>{@link xyz.firestige.redis.taskindex.api.ExpiredTaskCollector} - 过期软删除任务回收</li>
 *   <li>{@link xyz.firestige.redis.taskindex.api.RedisClient} - 存储抽象</li>
 * </ul>
 */
package xyz.firestige.redis.taskindex.api;
