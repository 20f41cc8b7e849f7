package xyz.firestige.redis.taskindex.api;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Redis 客户端抽象接口
 *
 * <p>定义任务索引所需的最小操作集：Hash、Set、ZSet 的读取，Key 扫描，以及原子批次写入。
 * 核心逻辑不依赖具体客户端。
 *
 * <h3>约定</h3>
 * <ul>
 *   <li>所有写操作只能通过 {@link #execute(RedisBatch)} 提交</li>
 *   <li>任何存储失败都以 {@link xyz.firestige.redis.taskindex.exception.TaskStorageException} 抛出</li>
 *   <li>不存在的 Key 按空结构处理，不抛异常</li>
 * </ul>
 *
 * <h3>实现</h3>
 * <ul>
 *   <li>{@code SpringRedisClient} - 基于 Spring Data Redis (StringRedisTemplate)</li>
 * </ul>
 *
 * @since 1.0
 */
public interface RedisClient {

    /**
     * HGETALL 操作
     *
     * @param key Redis Hash Key
     * @return 字段映射，Key 不存在时返回空映射
     */
    Map<String, String> hgetAll(String key);

    /**
     * 批量 HGETALL
     *
     * <p>实现应使用 Pipeline 减少网络往返。
     *
     * @param keys Redis Hash Key 列表
     * @return 与 {@code keys} 一一对应的字段映射，Key 不存在时对应空映射
     */
    List<Map<String, String>> hgetAll(List<String> keys);

    /**
     * SMEMBERS 操作
     *
     * @param key Redis Set Key
     * @return 成员集合
     */
    Set<String> smembers(String key);

    /**
     * SISMEMBER 操作
     *
     * @param key Redis Set Key
     * @param member 成员
     * @return 是否为成员
     */
    boolean sismember(String key, String member);

    /**
     * ZREVRANGE key 0 -1
     *
     * <p>按分数从高到低返回全部成员，分数相同时按成员字典序倒序。
     *
     * @param key Redis ZSet Key
     * @return 有序成员列表
     */
    List<String> zrevrange(String key);

    /**
     * ZRANGEBYSCORE 操作（闭区间）
     *
     * @param key Redis ZSet Key
     * @param min 最小分数（含）
     * @param max 最大分数（含）
     * @return 按分数升序排列的成员
     */
    List<String> zrangeByScore(String key, double min, double max);

    /**
     * 扫描匹配模式的 Key
     *
     * <p>实现应使用 SCAN 命令避免阻塞 Redis。
     *
     * @param pattern 匹配模式（如 "user:*:tasks:deleted"）
     * @param count 每次扫描数量（建议值）
     * @return 匹配的 Key 集合
     */
    Collection<String> scan(String pattern, int count);

    /**
     * 原子提交一个批次
     *
     * @param batch 写命令批次，空批次直接返回
     */
    void execute(RedisBatch batch);

    /**
     * PING
     *
     * @return {@code true} 连接正常
     */
    boolean ping();
}
