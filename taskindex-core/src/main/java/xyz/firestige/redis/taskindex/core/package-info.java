/**
 * Redis 任务索引默认实现
 * <p>
 * 只依赖 {@link xyz.firestige.redis.taskindex.api.RedisClient} 抽象，不直接依赖 Spring Data Redis。
 * <ul>
 *   <li>{@link xyz.firestige.redis.taskindex.core.RedisTaskIndexMaintainer} - 原子批次维护索引</li>
 *   <li>{@link xyz.firestige.redis.taskindex.core.RedisTaskQueryEngine} - 列表、分页、水合</li>
 *   <li>{@link xyz.firestige.redis.taskindex.core.RedisExpiredTaskCollector} - 过期回收</li>
 *   <li>{@link xyz.firestige.redis.taskindex.core.DefaultTaskService} - 服务门面</li>
 * </ul>
 */
package xyz.firestige.redis.taskindex.core;
