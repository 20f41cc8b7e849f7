package xyz.firestige.redis.taskindex.spring;

import xyz.firestige.redis.taskindex.api.RedisBatch;
import xyz.firestige.redis.taskindex.api.RedisClient;
import xyz.firestige.redis.taskindex.exception.TaskStorageException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 只记录写批次的 RedisClient，读操作返回空结构
 */
public class StubRedisClient implements RedisClient {

    private final List<RedisBatch> batches = new ArrayList<>();
    private volatile boolean reachable = true;

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public List<RedisBatch> getBatches() {
        return batches;
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        return Map.of();
    }

    @Override
    public List<Map<String, String>> hgetAll(List<String> keys) {
        return keys.stream().map(k -> Map.<String, String>of()).collect(Collectors.toList());
    }

    @Override
    public Set<String> smembers(String key) {
        return Set.of();
    }

    @Override
    public boolean sismember(String key, String member) {
        return false;
    }

    @Override
    public List<String> zrevrange(String key) {
        return List.of();
    }

    @Override
    public List<String> zrangeByScore(String key, double min, double max) {
        return List.of();
    }

    @Override
    public Collection<String> scan(String pattern, int count) {
        return List.of();
    }

    @Override
    public synchronized void execute(RedisBatch batch) {
        batches.add(batch);
    }

    @Override
    public boolean ping() {
        if (!reachable) {
            throw new TaskStorageException("connection refused");
        }
        return true;
    }
}
