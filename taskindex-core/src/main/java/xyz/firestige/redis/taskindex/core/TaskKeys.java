package xyz.firestige.redis.taskindex.core;

/**
 * 任务索引 Key 布局
 *
 * <pre>
 * task:{id}                       Hash  任务记录
 * user:{owner}:tasks              Set   活跃任务 id
 * user:{owner}:tasks:sorted       ZSet  活跃任务 id，score = 创建时间
 * user:{owner}:categories         Set   使用过的分类名
 * user:{owner}:category:{name}    Set   分类下的活跃任务 id
 * user:{owner}:tasks:deleted      ZSet  软删除任务 id，score = 删除时间
 * </pre>
 *
 * <p>配置了命名空间时，所有 Key 前加 {@code {namespace}:}。
 */
public class TaskKeys {

    private static final String TASK = "task:";
    private static final String USER = "user:";

    private final String prefix;

    public TaskKeys() {
        this(null);
    }

    public TaskKeys(String namespace) {
        this.prefix = namespace == null || namespace.isBlank() ? "" : namespace.trim() + ":";
    }

    public String task(String taskId) {
        return prefix + TASK + taskId;
    }

    public String activeSet(String ownerId) {
        return user(ownerId) + ":tasks";
    }

    public String activeOrder(String ownerId) {
        return user(ownerId) + ":tasks:sorted";
    }

    public String categories(String ownerId) {
        return user(ownerId) + ":categories";
    }

    public String categoryMembers(String ownerId, String category) {
        return user(ownerId) + ":category:" + category;
    }

    public String deletedOrder(String ownerId) {
        return user(ownerId) + ":tasks:deleted";
    }

    /**
     * 所有 owner 的 deleted-order Key 的 SCAN 模式
     */
    public String deletedOrderPattern() {
        return prefix + USER + "*:tasks:deleted";
    }

    /**
     * SCAN 命中的 Key 是否确为 deleted-order
     *
     * <p>分类名可以以 {@code :tasks:deleted} 结尾，此时 category-members 的 Key 同样匹配
     * {@link #deletedOrderPattern()}，其 owner 段含 {@code :category:}。
     */
    public boolean isDeletedOrder(String key) {
        String head = prefix + USER;
        String tail = ":tasks:deleted";
        if (key == null || !key.startsWith(head) || !key.endsWith(tail)
            || key.length() <= head.length() + tail.length()) {
            return false;
        }
        String ownerId = key.substring(head.length(), key.length() - tail.length());
        return !ownerId.contains(":category:");
    }

    private String user(String ownerId) {
        return prefix + USER + ownerId;
    }
}
