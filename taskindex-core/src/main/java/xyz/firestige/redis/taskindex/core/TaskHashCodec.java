package xyz.firestige.redis.taskindex.core;

import xyz.firestige.redis.taskindex.api.Task;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task 与 Redis Hash 之间的转换
 *
 * <p>时间戳以毫秒级 epoch 存储，与有序集合的 score 一致。
 * {@code deleted_at} 只在软删除时存在。
 */
public final class TaskHashCodec {

    public static final String ID = "id";
    public static final String OWNER_ID = "user_id";
    public static final String DESCRIPTION = "description";
    public static final String CATEGORY = "category";
    public static final String COMPLETED = "completed";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String DELETED_AT = "deleted_at";

    private TaskHashCodec() {
    }

    public static Map<String, String> encode(Task task) {
        Map<String, String> hash = new LinkedHashMap<>();
        hash.put(ID, task.getId());
        hash.put(OWNER_ID, task.getOwnerId());
        hash.put(DESCRIPTION, task.getDescription());
        hash.put(CATEGORY, task.getCategory());
        hash.put(COMPLETED, String.valueOf(task.isCompleted()));
        hash.put(CREATED_AT, encodeInstant(task.getCreatedAt()));
        hash.put(UPDATED_AT, encodeInstant(task.getUpdatedAt()));
        if (task.getDeletedAt() != null) {
            hash.put(DELETED_AT, encodeInstant(task.getDeletedAt()));
        }
        return hash;
    }

    /**
     * @return 解码结果，Hash 为空时返回 {@code null}
     */
    public static Task decode(Map<String, String> hash) {
        if (hash == null || hash.isEmpty()) {
            return null;
        }
        String completed = hash.get(COMPLETED);
        return Task.builder()
            .id(hash.get(ID))
            .ownerId(hash.get(OWNER_ID))
            .description(hash.get(DESCRIPTION))
            .category(hash.getOrDefault(CATEGORY, ""))
            .completed("true".equals(completed) || "1".equals(completed))
            .createdAt(decodeInstant(hash.get(CREATED_AT)))
            .updatedAt(decodeInstant(hash.get(UPDATED_AT)))
            .deletedAt(decodeInstant(hash.get(DELETED_AT)))
            .build();
    }

    public static String encodeInstant(Instant instant) {
        return String.valueOf(instant.toEpochMilli());
    }

    public static double score(Instant instant) {
        return instant.toEpochMilli();
    }

    // 无法解析的时间戳按缺失处理
    static Instant decodeInstant(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
