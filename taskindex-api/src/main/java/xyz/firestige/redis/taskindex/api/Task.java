package xyz.firestige.redis.taskindex.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * 任务实体
 *
 * <p>不可变对象。{@code deletedAt} 非空表示已软删除，为空表示活跃。
 * 空字符串 {@code category} 表示未分类。
 *
 * <p>JSON 字段名与传输层约定一致（{@code user_id}、{@code created_at} 等）。
 *
 * @since 1.0
 */
public final class Task {

    /** 描述最大长度（按字符计，去除首尾空白后） */
    public static final int MAX_DESCRIPTION_LENGTH = 10_000;

    private final String id;
    private final String ownerId;
    private final String description;
    private final String category;
    private final boolean completed;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant deletedAt;

    private Task(Builder builder) {
        this.id = builder.id;
        this.ownerId = builder.ownerId;
        this.description = builder.description;
        this.category = builder.category != null ? builder.category : "";
        this.completed = builder.completed;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.deletedAt = builder.deletedAt;
    }

    @JsonCreator
    private Task(@JsonProperty("id") String id,
                 @JsonProperty("user_id") String ownerId,
                 @JsonProperty("description") String description,
                 @JsonProperty("category") String category,
                 @JsonProperty("completed") boolean completed,
                 @JsonProperty("created_at") Instant createdAt,
                 @JsonProperty("updated_at") Instant updatedAt,
                 @JsonProperty("deleted_at") Instant deletedAt) {
        this(builder()
            .id(id)
            .ownerId(ownerId)
            .description(description)
            .category(category)
            .completed(completed)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .deletedAt(deletedAt));
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("user_id")
    public String getOwnerId() {
        return ownerId;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("category")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public String getCategory() {
        return category;
    }

    @JsonProperty("completed")
    public boolean isCompleted() {
        return completed;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("updated_at")
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @JsonProperty("deleted_at")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Instant getDeletedAt() {
        return deletedAt;
    }

    @JsonIgnore
    public boolean isDeleted() {
        return deletedAt != null;
    }

    @JsonIgnore
    public boolean isCategorized() {
        return !category.isEmpty();
    }

    public Builder toBuilder() {
        return builder()
            .id(id)
            .ownerId(ownerId)
            .description(description)
            .category(category)
            .completed(completed)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .deletedAt(deletedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Task)) {
            return false;
        }
        Task that = (Task) o;
        return completed == that.completed
            && Objects.equals(id, that.id)
            && Objects.equals(ownerId, that.ownerId)
            && Objects.equals(description, that.description)
            && Objects.equals(category, that.category)
            && Objects.equals(createdAt, that.createdAt)
            && Objects.equals(updatedAt, that.updatedAt)
            && Objects.equals(deletedAt, that.deletedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, ownerId, description, category, completed, createdAt, updatedAt, deletedAt);
    }

    @Override
    public String toString() {
        return "Task{" +
            "id='" + id + '\'' +
            ", ownerId='" + ownerId + '\'' +
            ", category='" + category + '\'' +
            ", completed=" + completed +
            ", createdAt=" + createdAt +
            ", updatedAt=" + updatedAt +
            ", deletedAt=" + deletedAt +
            '}';
    }

    public static final class Builder {
        private String id;
        private String ownerId;
        private String description;
        private String category = "";
        private boolean completed;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant deletedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder completed(boolean completed) {
            this.completed = completed;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
