package xyz.firestige.redis.taskindex.core;

import xyz.firestige.redis.taskindex.api.RedisClient;
import xyz.firestige.redis.taskindex.api.Task;
import xyz.firestige.redis.taskindex.exception.TaskNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 任务水合与归属检查
 *
 * <p>所有读路径共用的唯一 owner 检查点：记录缺失和 owner 不匹配一律视为不存在。
 */
class OwnedTaskResolver {

    private final RedisClient redisClient;
    private final TaskKeys keys;

    OwnedTaskResolver(RedisClient redisClient, TaskKeys keys) {
        this.redisClient = redisClient;
        this.keys = keys;
    }

    Optional<Task> resolve(String ownerId, String taskId) {
        return Optional.ofNullable(owned(ownerId, TaskHashCodec.decode(redisClient.hgetAll(keys.task(taskId)))));
    }

    Task require(String ownerId, String taskId) {
        return resolve(ownerId, taskId).orElseThrow(() -> TaskNotFoundException.task(taskId));
    }

    /**
     * 批量水合，保持输入顺序，丢弃缺失或不属于该 owner 的 id
     */
    List<Task> resolveAll(String ownerId, List<String> taskIds) {
        if (taskIds.isEmpty()) {
            return List.of();
        }
        List<String> taskKeys = new ArrayList<>(taskIds.size());
        for (String taskId : taskIds) {
            taskKeys.add(keys.task(taskId));
        }
        List<Map<String, String>> hashes = redisClient.hgetAll(taskKeys);
        List<Task> tasks = new ArrayList<>(hashes.size());
        for (Map<String, String> hash : hashes) {
            Task task = owned(ownerId, TaskHashCodec.decode(hash));
            if (task != null) {
                tasks.add(task);
            }
        }
        return tasks;
    }

    private static Task owned(String ownerId, Task task) {
        if (task == null || !ownerId.equals(task.getOwnerId())) {
            return null;
        }
        return task;
    }
}
