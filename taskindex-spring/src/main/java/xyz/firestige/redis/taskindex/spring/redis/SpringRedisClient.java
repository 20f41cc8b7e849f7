package xyz.firestige.redis.taskindex.spring.redis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.redis.taskindex.api.RedisBatch;
import xyz.firestige.redis.taskindex.api.RedisClient;
import xyz.firestige.redis.taskindex.exception.TaskStorageException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Spring Data Redis 客户端适配器
 *
 * <h3>特性</h3>
 * <ul>
 *   <li>批次在同一连接上以 MULTI/EXEC 提交</li>
 *   <li>批量 HGETALL 使用 Pipeline</li>
 *   <li>使用 SCAN 命令枚举 Key，避免阻塞</li>
 * </ul>
 *
 * <p>{@link DataAccessException} 统一转换为 {@link TaskStorageException}。
 *
 * @since 1.0
 */
public class SpringRedisClient implements RedisClient {

    private static final Logger log = LoggerFactory.getLogger(SpringRedisClient.class);

    private final StringRedisTemplate redisTemplate;

    public SpringRedisClient(StringRedisTemplate redisTemplate) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate cannot be null");
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        Map<Object, Object> entries = call("HGETALL " + key, () -> redisTemplate.opsForHash().entries(key));
        Map<String, String> hash = new HashMap<>(entries.size());
        entries.forEach((field, value) -> hash.put(String.valueOf(field), String.valueOf(value)));
        return hash;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Map<String, String>> hgetAll(List<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }
        List<Object> raw = call("pipelined HGETALL x" + keys.size(), () -> redisTemplate.executePipelined(
            (RedisCallback<Object>) connection -> {
                for (String key : keys) {
                    connection.hashCommands().hGetAll(key.getBytes(StandardCharsets.UTF_8));
                }
                return null;
            }));

        List<Map<String, String>> hashes = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            Object result = i < raw.size() ? raw.get(i) : null;
            hashes.add(result instanceof Map ? (Map<String, String>) result : Collections.emptyMap());
        }
        return hashes;
    }

    @Override
    public Set<String> smembers(String key) {
        Set<String> members = call("SMEMBERS " + key, () -> redisTemplate.opsForSet().members(key));
        return members != null ? members : Collections.emptySet();
    }

    @Override
    public boolean sismember(String key, String member) {
        return Boolean.TRUE.equals(call("SISMEMBER " + key, () -> redisTemplate.opsForSet().isMember(key, member)));
    }

    @Override
    public List<String> zrevrange(String key) {
        Set<String> members = call("ZREVRANGE " + key, () -> redisTemplate.opsForZSet().reverseRange(key, 0, -1));
        return members != null ? new ArrayList<>(members) : Collections.emptyList();
    }

    @Override
    public List<String> zrangeByScore(String key, double min, double max) {
        Set<String> members = call("ZRANGEBYSCORE " + key,
            () -> redisTemplate.opsForZSet().rangeByScore(key, min, max));
        return members != null ? new ArrayList<>(members) : Collections.emptyList();
    }

    @Override
    public Collection<String> scan(String pattern, int count) {
        ScanOptions options = ScanOptions.scanOptions()
            .match(pattern)
            .count(count)
            .build();
        Set<String> keys = call("SCAN " + pattern, () -> redisTemplate.execute((RedisCallback<Set<String>>) connection -> {
            Set<String> found = new LinkedHashSet<>();
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    found.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return found;
        }));
        return keys != null ? keys : Collections.emptySet();
    }

    @Override
    public void execute(RedisBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        List<Object> results = call("EXEC " + batch.size() + " commands", () -> redisTemplate.execute(
            new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.multi();
                    for (RedisBatch.Command command : batch.getCommands()) {
                        queue(ops, command);
                    }
                    return ops.exec();
                }
            }));
        // 未使用 WATCH 时 EXEC 只会在事务被丢弃时返回 null
        if (results == null) {
            log.debug("事务被丢弃: {}", batch);
            throw new TaskStorageException("transaction discarded: " + batch.size() + " commands");
        }
    }

    @Override
    public boolean ping() {
        String reply = call("PING", () -> redisTemplate.execute((RedisCallback<String>) connection -> connection.ping()));
        return "PONG".equalsIgnoreCase(reply);
    }

    private static void queue(RedisOperations<String, String> ops, RedisBatch.Command command) {
        String key = command.getKey();
        Object[] members = command.getMembers().toArray();
        switch (command.getType()) {
            case HSET:
                ops.opsForHash().putAll(key, command.getFields());
                break;
            case HDEL:
                ops.opsForHash().delete(key, members);
                break;
            case SADD:
                ops.opsForSet().add(key, command.getMembers().toArray(new String[0]));
                break;
            case SREM:
                ops.opsForSet().remove(key, members);
                break;
            case ZADD:
                ops.opsForZSet().add(key, command.getMembers().get(0), command.getScore());
                break;
            case ZREM:
                ops.opsForZSet().remove(key, members);
                break;
            case DEL:
                ops.delete(key);
                break;
            default:
                throw new IllegalArgumentException("unsupported command: " + command.getType());
        }
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.debug("Redis 操作失败: operation={}, error={}", operation, e.getMessage(), e);
            throw new TaskStorageException("redis operation failed: " + operation, e);
        }
    }
}
