package xyz.firestige.redis.taskindex.core;

import xyz.firestige.redis.taskindex.api.Task;
import xyz.firestige.redis.taskindex.api.TaskFilter;
import xyz.firestige.redis.taskindex.api.TaskIndexMaintainer;
import xyz.firestige.redis.taskindex.api.TaskQueryEngine;
import xyz.firestige.redis.taskindex.api.TaskService;
import xyz.firestige.redis.taskindex.exception.TaskConflictException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 任务服务默认实现
 *
 * <p>负责 id 生成、输入规整（去除首尾空白）和恢复窗口检查，其余委托给
 * {@link TaskIndexMaintainer} 与 {@link TaskQueryEngine}。
 *
 * @since 1.0
 */
public class DefaultTaskService implements TaskService {

    private final TaskIndexMaintainer maintainer;
    private final TaskQueryEngine queryEngine;
    private final Clock clock;
    private final Duration recoveryWindow;
    private final Supplier<String> idGenerator;

    public DefaultTaskService(TaskIndexMaintainer maintainer, TaskQueryEngine queryEngine, Clock clock) {
        this(maintainer, queryEngine, clock, RedisExpiredTaskCollector.DEFAULT_RECOVERY_WINDOW,
            () -> UUID.randomUUID().toString());
    }

    public DefaultTaskService(TaskIndexMaintainer maintainer,
                              TaskQueryEngine queryEngine,
                              Clock clock,
                              Duration recoveryWindow,
                              Supplier<String> idGenerator) {
        this.maintainer = Objects.requireNonNull(maintainer, "maintainer cannot be null");
        this.queryEngine = Objects.requireNonNull(queryEngine, "queryEngine cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.recoveryWindow = Objects.requireNonNull(recoveryWindow, "recoveryWindow cannot be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator cannot be null");
    }

    @Override
    public Task createTask(String ownerId, String description, String category) {
        TaskValidator.requireOwner(ownerId);
        TaskValidator.validateDescription(description);

        Instant now = now();
        Task task = Task.builder()
            .id(idGenerator.get())
            .ownerId(ownerId)
            .description(description.trim())
            .category(category == null ? "" : category.trim())
            .completed(false)
            .createdAt(now)
            .updatedAt(now)
            .build();
        maintainer.create(task);
        return task;
    }

    @Override
    public Task getTask(String ownerId, String taskId) {
        return queryEngine.get(ownerId, taskId);
    }

    @Override
    public List<Task> listTasks(String ownerId, TaskFilter filter) {
        return queryEngine.list(ownerId, filter != null ? filter : TaskFilter.defaults());
    }

    @Override
    public Task updateCompletion(String ownerId, String taskId, boolean completed) {
        maintainer.setCompletion(ownerId, taskId, completed);
        return queryEngine.get(ownerId, taskId);
    }

    @Override
    public void deleteTask(String ownerId, String taskId) {
        maintainer.softDelete(ownerId, taskId);
    }

    @Override
    public Task restoreTask(String ownerId, String taskId) {
        Task task = queryEngine.get(ownerId, taskId);
        if (!task.isDeleted()) {
            throw new TaskConflictException("task is not deleted: " + taskId);
        }
        if (task.getDeletedAt().isBefore(now().minus(recoveryWindow))) {
            throw new TaskConflictException("task cannot be restored after " + recoveryWindow.toDays() + " days");
        }
        maintainer.restore(ownerId, taskId);
        return queryEngine.get(ownerId, taskId);
    }

    @Override
    public List<String> listCategories(String ownerId) {
        return queryEngine.categories(ownerId);
    }

    @Override
    public void renameCategory(String ownerId, String oldName, String newName) {
        maintainer.renameCategory(ownerId, trim(oldName), trim(newName));
    }

    @Override
    public void deleteCategory(String ownerId, String name) {
        maintainer.deleteCategory(ownerId, trim(name));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
