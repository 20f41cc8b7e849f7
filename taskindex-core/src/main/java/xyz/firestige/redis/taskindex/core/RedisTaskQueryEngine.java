package xyz.firestige.redis.taskindex.core;

import xyz.firestige.redis.taskindex.api.RedisClient;
import xyz.firestige.redis.taskindex.api.Task;
import xyz.firestige.redis.taskindex.api.TaskFilter;
import xyz.firestige.redis.taskindex.api.TaskQueryEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 基于 Redis 的查询引擎
 *
 * <h3>列表算法</h3>
 * <ol>
 *   <li>候选 id：指定分类时取 category-members（按 id 排序以保证分页稳定），否则按创建时间倒序取 active-order；
 *       {@code includeDeleted} 时在其后追加按删除时间倒序的 deleted-order</li>
 *   <li>在候选 id 序列上做 offset/limit 切片</li>
 *   <li>批量水合，跳过记录缺失或 owner 不匹配的 id</li>
 *   <li>按 {@code completed} 过滤水合结果</li>
 * </ol>
 *
 * @since 1.0
 */
public class RedisTaskQueryEngine implements TaskQueryEngine {

    private final RedisClient redisClient;
    private final TaskKeys keys;
    private final int maxLimit;
    private final OwnedTaskResolver resolver;

    public RedisTaskQueryEngine(RedisClient redisClient, TaskKeys keys) {
        this(redisClient, keys, TaskValidator.DEFAULT_MAX_LIMIT);
    }

    public RedisTaskQueryEngine(RedisClient redisClient, TaskKeys keys, int maxLimit) {
        this.redisClient = Objects.requireNonNull(redisClient, "redisClient cannot be null");
        this.keys = Objects.requireNonNull(keys, "keys cannot be null");
        if (maxLimit <= 0) {
            throw new IllegalArgumentException("maxLimit must be positive");
        }
        this.maxLimit = maxLimit;
        this.resolver = new OwnedTaskResolver(redisClient, keys);
    }

    @Override
    public List<Task> list(String ownerId, TaskFilter filter) {
        TaskValidator.requireOwner(ownerId);
        TaskValidator.validateFilter(filter, maxLimit);

        List<String> candidates = candidateIds(ownerId, filter);
        List<String> page = slice(candidates, filter.getOffset(), filter.getLimit());
        List<Task> tasks = resolver.resolveAll(ownerId, page);

        Boolean completed = filter.getCompleted();
        if (completed == null) {
            return tasks;
        }
        return tasks.stream()
            .filter(task -> task.isCompleted() == completed)
            .collect(Collectors.toList());
    }

    @Override
    public Task get(String ownerId, String taskId) {
        TaskValidator.requireOwner(ownerId);
        TaskValidator.requireTaskId(taskId);
        return resolver.require(ownerId, taskId);
    }

    @Override
    public List<String> categories(String ownerId) {
        TaskValidator.requireOwner(ownerId);
        return redisClient.smembers(keys.categories(ownerId)).stream()
            .filter(name -> !name.trim().isEmpty())
            .sorted()
            .collect(Collectors.toList());
    }

    private List<String> candidateIds(String ownerId, TaskFilter filter) {
        List<String> ids = new ArrayList<>();
        if (filter.hasCategory()) {
            redisClient.smembers(keys.categoryMembers(ownerId, filter.getCategory())).stream()
                .sorted()
                .forEach(ids::add);
        } else {
            ids.addAll(redisClient.zrevrange(keys.activeOrder(ownerId)));
        }
        if (filter.isIncludeDeleted()) {
            ids.addAll(redisClient.zrevrange(keys.deletedOrder(ownerId)));
        }
        return ids;
    }

    static List<String> slice(List<String> ids, int offset, int limit) {
        if (offset >= ids.size()) {
            return List.of();
        }
        int end = limit == 0 ? ids.size() : (int) Math.min(ids.size(), (long) offset + limit);
        return ids.subList(offset, end);
    }
}
