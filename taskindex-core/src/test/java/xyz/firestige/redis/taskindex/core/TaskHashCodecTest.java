package xyz.firestige.redis.taskindex.core;

import org.junit.jupiter.api.Test;
import xyz.firestige.redis.taskindex.api.Task;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNull;

class TaskHashCodecTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:00:00.123Z");

    @Test
    void encode_activeTask_omitsDeletedAt() {
        Task task = Task.builder()
            .id("t1").ownerId("u1").description("write report").category("work")
            .createdAt(CREATED).updatedAt(CREATED)
            .build();

        Map<String, String> hash = TaskHashCodec.encode(task);

        assertThat(hash)
            .containsEntry("id", "t1")
            .containsEntry("user_id", "u1")
            .containsEntry("description", "write report")
            .containsEntry("category", "work")
            .containsEntry("completed", "false")
            .containsEntry("created_at", String.valueOf(CREATED.toEpochMilli()))
            .doesNotContainKey("deleted_at");
    }

    @Test
    void decode_legacyNumericFlag_readsAsCompleted() {
        Map<String, String> hash = new HashMap<>();
        hash.put("id", "t1");
        hash.put("user_id", "u1");
        hash.put("description", "x");
        hash.put("completed", "1");
        hash.put("created_at", "1709287200000");
        hash.put("updated_at", "1709287200000");

        Task task = TaskHashCodec.decode(hash);

        assertThat(task.isCompleted()).isTrue();
        assertThat(task.getCategory()).isEmpty();
        assertThat(task.getCreatedAt()).isEqualTo(Instant.ofEpochMilli(1709287200000L));
        assertThat(task.isDeleted()).isFalse();
    }

    @Test
    void decode_deletedTask_keepsDeletionTimestamp() {
        Instant deleted = CREATED.plusSeconds(60);
        Task task = Task.builder()
            .id("t1").ownerId("u1").description("x")
            .createdAt(CREATED).updatedAt(deleted).deletedAt(deleted)
            .build();

        Task decoded = TaskHashCodec.decode(TaskHashCodec.encode(task));

        assertThat(decoded.getDeletedAt()).isEqualTo(deleted);
        assertThat(decoded).isEqualTo(task);
    }

    @Test
    void decode_emptyHash_returnsNull() {
        assertNull(TaskHashCodec.decode(Map.of()));
        assertNull(TaskHashCodec.decode(null));
    }

    @Test
    void decodeInstant_garbage_treatedAsMissing() {
        assertNull(TaskHashCodec.decodeInstant("yesterday"));
        assertNull(TaskHashCodec.decodeInstant(""));
    }
}
