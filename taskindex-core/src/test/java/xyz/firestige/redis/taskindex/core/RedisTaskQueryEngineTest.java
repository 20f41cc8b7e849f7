package xyz.firestige.redis.taskindex.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.redis.taskindex.api.Task;
import xyz.firestige.redis.taskindex.api.TaskFilter;
import xyz.firestige.redis.taskindex.exception.TaskNotFoundException;
import xyz.firestige.redis.taskindex.exception.TaskValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RedisTaskQueryEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final String OWNER = "u1";

    private InMemoryRedisClient client;
    private TaskKeys keys;
    private MutableClock clock;
    private RedisTaskIndexMaintainer maintainer;
    private RedisTaskQueryEngine engine;

    @BeforeEach
    void setUp() {
        client = new InMemoryRedisClient();
        keys = new TaskKeys();
        clock = new MutableClock(T0);
        maintainer = new RedisTaskIndexMaintainer(client, keys, clock);
        engine = new RedisTaskQueryEngine(client, keys, 50);
    }

    private void create(String id, String category, int secondsAfterT0) {
        Instant created = T0.plusSeconds(secondsAfterT0);
        maintainer.create(Task.builder()
            .id(id).ownerId(OWNER).description("task " + id).category(category)
            .createdAt(created).updatedAt(created)
            .build());
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::getId).collect(Collectors.toList());
    }

    @Test
    void list_newestFirst() {
        create("a", "", 0);
        create("b", "", 10);
        create("c", "", 5);

        assertThat(ids(engine.list(OWNER, TaskFilter.defaults()))).containsExactly("b", "c", "a");
    }

    @Test
    void list_pagesConcatenateToFullOrdering() {
        for (int i = 0; i < 23; i++) {
            create(String.format("t%02d", i), "", i % 7);
        }
        List<String> full = ids(engine.list(OWNER, TaskFilter.defaults()));
        assertThat(full).hasSize(23);

        List<String> paged = new ArrayList<>();
        for (int offset = 0; offset < 30; offset += 5) {
            List<Task> page = engine.list(OWNER, TaskFilter.builder().limit(5).offset(offset).build());
            assertThat(page).hasSize(Math.min(5, Math.max(0, 23 - offset)));
            paged.addAll(ids(page));
        }
        assertThat(paged).isEqualTo(full);
    }

    @Test
    void list_offsetPastEnd_empty() {
        create("a", "", 0);

        assertThat(engine.list(OWNER, TaskFilter.builder().offset(5).limit(10).build())).isEmpty();
    }

    @Test
    void list_byCategory_sortedById() {
        create("c", "work", 0);
        create("a", "work", 1);
        create("b", "home", 2);
        create("d", "work", 3);

        List<Task> tasks = engine.list(OWNER, TaskFilter.builder().category("work").build());

        assertThat(ids(tasks)).containsExactly("a", "c", "d");
        assertThat(tasks).allMatch(task -> task.getCategory().equals("work"));
    }

    @Test
    void list_completedFilter_appliedAfterPaging() {
        create("a", "", 0);
        create("b", "", 1);
        create("c", "", 2);
        maintainer.setCompletion(OWNER, "c", true);

        assertThat(ids(engine.list(OWNER, TaskFilter.builder().completed(true).build()))).containsExactly("c");
        assertThat(ids(engine.list(OWNER, TaskFilter.builder().completed(false).build()))).containsExactly("b", "a");
        // 第一页是 [c, b]，过滤后只剩 b
        assertThat(ids(engine.list(OWNER, TaskFilter.builder().completed(false).limit(2).build())))
            .containsExactly("b");
    }

    @Test
    void list_includeDeleted_appendsDeletedAfterActive() {
        create("a", "", 0);
        create("b", "", 1);
        create("c", "", 2);
        clock.advance(Duration.ofMinutes(1));
        maintainer.softDelete(OWNER, "a");
        clock.advance(Duration.ofMinutes(1));
        maintainer.softDelete(OWNER, "c");

        assertThat(ids(engine.list(OWNER, TaskFilter.defaults()))).containsExactly("b");
        List<Task> all = engine.list(OWNER, TaskFilter.builder().includeDeleted(true).build());
        assertThat(ids(all)).containsExactly("b", "c", "a");
        assertThat(all.get(1).getDeletedAt()).isNotNull();
    }

    @Test
    void list_skipsDanglingAndForeignIds() {
        create("a", "", 0);
        client.addToZset(keys.activeOrder(OWNER), "ghost", T0.plusSeconds(50).toEpochMilli());
        client.putHash(keys.task("x"), Map.of("id", "x", "user_id", "u2", "description", "theirs",
            "completed", "false", "created_at", "0", "updated_at", "0"));
        client.addToZset(keys.activeOrder(OWNER), "x", T0.plusSeconds(60).toEpochMilli());

        assertThat(ids(engine.list(OWNER, TaskFilter.defaults()))).containsExactly("a");
    }

    @Test
    void list_limitAboveMax_rejectedBeforeStoreCall() {
        assertThrows(TaskValidationException.class,
            () -> engine.list(OWNER, TaskFilter.builder().limit(51).build()));
        assertThrows(TaskValidationException.class, () -> engine.list(" ", TaskFilter.defaults()));
        assertEquals(0, client.calls());
    }

    @Test
    void list_unknownOwner_empty() {
        assertThat(engine.list("nobody", TaskFilter.defaults())).isEmpty();
    }

    @Test
    void get_foreignOwner_notFound() {
        create("a", "", 0);

        assertThat(engine.get(OWNER, "a").getDescription()).isEqualTo("task a");
        assertThrows(TaskNotFoundException.class, () -> engine.get("u2", "a"));
        assertThrows(TaskNotFoundException.class, () -> engine.get(OWNER, "missing"));
    }

    @Test
    void get_softDeletedTask_stillReadable() {
        create("a", "", 0);
        maintainer.softDelete(OWNER, "a");

        assertThat(engine.get(OWNER, "a").isDeleted()).isTrue();
    }

    @Test
    void categories_sortedAndStickyAfterSoftDelete() {
        create("a", "work", 0);
        create("b", "home", 1);
        maintainer.softDelete(OWNER, "a");
        client.addToSet(keys.categories(OWNER), " ");

        assertThat(engine.categories(OWNER)).containsExactly("home", "work");
        assertThat(engine.list(OWNER, TaskFilter.builder().category("work").build())).isEmpty();
    }

    @Test
    void slice_limitZeroMeansUnbounded() {
        List<String> ids = List.of("a", "b", "c");

        assertThat(RedisTaskQueryEngine.slice(ids, 1, 0)).containsExactly("b", "c");
        assertThat(RedisTaskQueryEngine.slice(ids, 1, 1)).containsExactly("b");
        assertThat(RedisTaskQueryEngine.slice(ids, 3, 1)).isEmpty();
        assertThat(RedisTaskQueryEngine.slice(ids, 2, Integer.MAX_VALUE)).containsExactly("c");
    }
}
