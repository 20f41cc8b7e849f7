package xyz.firestige.redis.taskindex.api;

import java.util.Objects;

/**
 * 任务列表过滤条件
 *
 * <ul>
 *   <li>{@code category} - 精确匹配，为空表示不过滤</li>
 *   <li>{@code completed} - 三态：{@code null} 不过滤，{@code true}/{@code false} 按完成状态过滤</li>
 *   <li>{@code includeDeleted} - 是否在活跃任务之后追加已删除任务</li>
 *   <li>{@code limit} - 0 表示不限制，上限由查询引擎配置</li>
 *   <li>{@code offset} - 非负</li>
 * </ul>
 *
 * <p>分页作用于候选 id 序列，而不是水合后的结果，因此 {@code completed} 过滤可能使一页少于 {@code limit} 条。
 *
 * @since 1.0
 */
public final class TaskFilter {

    private static final TaskFilter DEFAULTS = builder().build();

    private final String category;
    private final Boolean completed;
    private final boolean includeDeleted;
    private final int limit;
    private final int offset;

    private TaskFilter(Builder builder) {
        this.category = builder.category;
        this.completed = builder.completed;
        this.includeDeleted = builder.includeDeleted;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static TaskFilter defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCategory() {
        return category;
    }

    public boolean hasCategory() {
        return category != null && !category.isEmpty();
    }

    public Boolean getCompleted() {
        return completed;
    }

    public boolean isIncludeDeleted() {
        return includeDeleted;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskFilter)) {
            return false;
        }
        TaskFilter that = (TaskFilter) o;
        return includeDeleted == that.includeDeleted
            && limit == that.limit
            && offset == that.offset
            && Objects.equals(category, that.category)
            && Objects.equals(completed, that.completed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, completed, includeDeleted, limit, offset);
    }

    @Override
    public String toString() {
        return "TaskFilter{category='" + category + "', completed=" + completed
            + ", includeDeleted=" + includeDeleted + ", limit=" + limit + ", offset=" + offset + '}';
    }

    public static final class Builder {
        private String category;
        private Boolean completed;
        private boolean includeDeleted;
        private int limit;
        private int offset;

        private Builder() {
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder completed(Boolean completed) {
            this.completed = completed;
            return this;
        }

        public Builder includeDeleted(boolean includeDeleted) {
            this.includeDeleted = includeDeleted;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public TaskFilter build() {
            return new TaskFilter(this);
        }
    }
}
