package xyz.firestige.redis.taskindex.core;

import xyz.firestige.redis.taskindex.api.Task;
import xyz.firestige.redis.taskindex.api.TaskFilter;
import xyz.firestige.redis.taskindex.exception.TaskValidationException;

/**
 * 任务与过滤条件校验
 *
 * <p>所有校验都在任何存储命令之前执行，失败抛出 {@link TaskValidationException}。
 */
public final class TaskValidator {

    /** 默认分页上限 */
    public static final int DEFAULT_MAX_LIMIT = 1000;

    private TaskValidator() {
    }

    /**
     * 校验待写入的任务
     */
    public static void validate(Task task) {
        if (task == null) {
            throw new TaskValidationException("task cannot be null");
        }
        requireTaskId(task.getId());
        requireOwner(task.getOwnerId());
        validateDescription(task.getDescription());
        if (task.getCreatedAt() == null || task.getUpdatedAt() == null) {
            throw new TaskValidationException("task timestamps are required");
        }
    }

    public static void validateDescription(String description) {
        String trimmed = description == null ? "" : description.trim();
        if (trimmed.isEmpty()) {
            throw new TaskValidationException("task description cannot be empty");
        }
        if (trimmed.codePointCount(0, trimmed.length()) > Task.MAX_DESCRIPTION_LENGTH) {
            throw new TaskValidationException(
                "task description cannot exceed " + Task.MAX_DESCRIPTION_LENGTH + " characters");
        }
    }

    public static void requireOwner(String ownerId) {
        if (isBlank(ownerId)) {
            throw new TaskValidationException("owner id is required");
        }
    }

    public static void requireTaskId(String taskId) {
        if (isBlank(taskId)) {
            throw new TaskValidationException("task id is required");
        }
    }

    public static void requireCategoryName(String name) {
        if (isBlank(name)) {
            throw new TaskValidationException("category name cannot be empty");
        }
    }

    /**
     * @param maxLimit {@code limit} 上限
     */
    public static void validateFilter(TaskFilter filter, int maxLimit) {
        if (filter == null) {
            throw new TaskValidationException("filter cannot be null");
        }
        if (filter.getLimit() < 0 || filter.getLimit() > maxLimit) {
            throw new TaskValidationException("limit must be between 0 and " + maxLimit);
        }
        if (filter.getOffset() < 0) {
            throw new TaskValidationException("offset must be non-negative");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
