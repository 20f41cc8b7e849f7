package xyz.firestige.redis.taskindex.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.taskindex.api.RedisBatch;
import xyz.firestige.redis.taskindex.api.RedisClient;
import xyz.firestige.redis.taskindex.api.Task;
import xyz.firestige.redis.taskindex.api.TaskIndexMaintainer;
import xyz.firestige.redis.taskindex.exception.TaskConflictException;
import xyz.firestige.redis.taskindex.exception.TaskNotFoundException;
import xyz.firestige.redis.taskindex.exception.TaskValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Redis 的索引维护器
 *
 * <p>每个写操作先完成校验和必要的读取，再把任务记录与全部二级结构的变更放进同一个
 * {@link RedisBatch} 一次提交。批次失败时没有任何部分状态可见。
 *
 * <h3>不变量</h3>
 * <ul>
 *   <li>id 在 active-set / active-order 中 ⇔ 记录存在且 deleted_at 为空</li>
 *   <li>id 在 category-members(c) 中 ⇔ 任务活跃且分类为 c</li>
 *   <li>id 在 deleted-order 中 ⇔ 记录存在且 deleted_at 非空</li>
 * </ul>
 *
 * <p>同一任务上的并发写不做排序，后提交的批次覆盖先提交的。
 * {@code setCompletion} 与 {@code restore} 先读后写且不 WATCH，若回收在两步之间擦除了该任务，
 * 随后的批次可能重新写出不完整的记录或索引项。
 *
 * @since 1.0
 */
public class RedisTaskIndexMaintainer implements TaskIndexMaintainer {

    private static final Logger log = LoggerFactory.getLogger(RedisTaskIndexMaintainer.class);

    private final RedisClient redisClient;
    private final TaskKeys keys;
    private final Clock clock;
    private final OwnedTaskResolver resolver;

    public RedisTaskIndexMaintainer(RedisClient redisClient, TaskKeys keys, Clock clock) {
        this.redisClient = Objects.requireNonNull(redisClient, "redisClient cannot be null");
        this.keys = Objects.requireNonNull(keys, "keys cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.resolver = new OwnedTaskResolver(redisClient, keys);
    }

    @Override
    public void create(Task task) {
        TaskValidator.validate(task);
        if (task.isDeleted()) {
            throw new TaskValidationException("a new task cannot carry a deletion timestamp");
        }
        String ownerId = task.getOwnerId();
        String taskId = task.getId();

        RedisBatch.Builder batch = RedisBatch.builder()
            .hset(keys.task(taskId), TaskHashCodec.encode(task))
            .sadd(keys.activeSet(ownerId), taskId)
            .zadd(keys.activeOrder(ownerId), taskId, TaskHashCodec.score(task.getCreatedAt()));
        if (task.isCategorized()) {
            batch.sadd(keys.categories(ownerId), task.getCategory())
                .sadd(keys.categoryMembers(ownerId, task.getCategory()), taskId);
        }
        redisClient.execute(batch.build());
    }

    @Override
    public void setCompletion(String ownerId, String taskId, boolean completed) {
        TaskValidator.requireOwner(ownerId);
        TaskValidator.requireTaskId(taskId);
        resolver.require(ownerId, taskId);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(TaskHashCodec.COMPLETED, String.valueOf(completed));
        fields.put(TaskHashCodec.UPDATED_AT, TaskHashCodec.encodeInstant(now()));
        redisClient.execute(RedisBatch.builder()
            .hset(keys.task(taskId), fields)
            .build());
    }

    @Override
    public void softDelete(String ownerId, String taskId) {
        TaskValidator.requireOwner(ownerId);
        TaskValidator.requireTaskId(taskId);
        Task task = resolver.require(ownerId, taskId);
        if (task.isDeleted()) {
            throw new TaskConflictException("task is already deleted: " + taskId);
        }

        Instant now = now();
        String timestamp = TaskHashCodec.encodeInstant(now);
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(TaskHashCodec.DELETED_AT, timestamp);
        fields.put(TaskHashCodec.UPDATED_AT, timestamp);

        RedisBatch.Builder batch = RedisBatch.builder()
            .hset(keys.task(taskId), fields)
            .srem(keys.activeSet(ownerId), taskId)
            .zrem(keys.activeOrder(ownerId), taskId);
        // categories(owner) 保持不变，分类只由 deleteCategory 显式移除
        if (task.isCategorized()) {
            batch.srem(keys.categoryMembers(ownerId, task.getCategory()), taskId);
        }
        batch.zadd(keys.deletedOrder(ownerId), taskId, TaskHashCodec.score(now));
        redisClient.execute(batch.build());
    }

    @Override
    public void restore(String ownerId, String taskId) {
        TaskValidator.requireOwner(ownerId);
        TaskValidator.requireTaskId(taskId);
        Task task = resolver.require(ownerId, taskId);
        if (!task.isDeleted()) {
            throw new TaskConflictException("task is not deleted: " + taskId);
        }

        RedisBatch.Builder batch = RedisBatch.builder()
            .hdel(keys.task(taskId), TaskHashCodec.DELETED_AT)
            .hset(keys.task(taskId), TaskHashCodec.UPDATED_AT, TaskHashCodec.encodeInstant(now()))
            .sadd(keys.activeSet(ownerId), taskId)
            .zadd(keys.activeOrder(ownerId), taskId, TaskHashCodec.score(task.getCreatedAt()));
        if (task.isCategorized()) {
            // 分类可能在删除期间被重命名或删除，重新登记以保持 categories 与成员集合一致
            batch.sadd(keys.categories(ownerId), task.getCategory())
                .sadd(keys.categoryMembers(ownerId, task.getCategory()), taskId);
        }
        batch.zrem(keys.deletedOrder(ownerId), taskId);
        redisClient.execute(batch.build());
    }

    @Override
    public void renameCategory(String ownerId, String oldName, String newName) {
        TaskValidator.requireOwner(ownerId);
        TaskValidator.requireCategoryName(oldName);
        TaskValidator.requireCategoryName(newName);
        if (oldName.equals(newName)) {
            throw new TaskConflictException("new category name must be different");
        }
        String categoriesKey = keys.categories(ownerId);
        if (!redisClient.sismember(categoriesKey, oldName)) {
            if (redisClient.sismember(categoriesKey, newName)) {
                throw new TaskConflictException("category already renamed: " + oldName + " -> " + newName);
            }
            throw TaskNotFoundException.category(oldName);
        }

        String oldMembersKey = keys.categoryMembers(ownerId, oldName);
        List<Task> members = memberTasks(ownerId, oldMembersKey);
        String timestamp = TaskHashCodec.encodeInstant(now());

        RedisBatch.Builder batch = RedisBatch.builder();
        List<String> movedIds = new ArrayList<>(members.size());
        for (Task task : members) {
            batch.hset(keys.task(task.getId()), categoryUpdate(newName, timestamp));
            movedIds.add(task.getId());
        }
        batch.sadd(keys.categoryMembers(ownerId, newName), movedIds)
            .srem(categoriesKey, oldName)
            .sadd(categoriesKey, newName)
            .del(oldMembersKey);
        redisClient.execute(batch.build());
        log.debug("分类重命名: owner={}, {} -> {}, tasks={}", ownerId, oldName, newName, movedIds.size());
    }

    @Override
    public void deleteCategory(String ownerId, String name) {
        TaskValidator.requireOwner(ownerId);
        TaskValidator.requireCategoryName(name);
        String categoriesKey = keys.categories(ownerId);
        if (!redisClient.sismember(categoriesKey, name)) {
            throw TaskNotFoundException.category(name);
        }

        String membersKey = keys.categoryMembers(ownerId, name);
        List<Task> members = memberTasks(ownerId, membersKey);
        String timestamp = TaskHashCodec.encodeInstant(now());

        RedisBatch.Builder batch = RedisBatch.builder();
        for (Task task : members) {
            batch.hset(keys.task(task.getId()), categoryUpdate("", timestamp));
        }
        batch.srem(categoriesKey, name)
            .del(membersKey);
        redisClient.execute(batch.build());
        log.debug("分类删除: owner={}, category={}, tasks={}", ownerId, name, members.size());
    }

    /**
     * 读取分类成员并水合，记录缺失或不属于该 owner 的 id 不会被写回，避免生成残缺的 Hash
     */
    private List<Task> memberTasks(String ownerId, String membersKey) {
        List<String> ids = new ArrayList<>(redisClient.smembers(membersKey));
        return resolver.resolveAll(ownerId, ids);
    }

    private static Map<String, String> categoryUpdate(String category, String timestamp) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(TaskHashCodec.CATEGORY, category);
        fields.put(TaskHashCodec.UPDATED_AT, timestamp);
        return fields;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
