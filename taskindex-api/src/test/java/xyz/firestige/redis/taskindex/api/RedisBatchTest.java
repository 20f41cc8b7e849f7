package xyz.firestige.redis.taskindex.api;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RedisBatchTest {

    @Test
    void build_keepsCommandOrder() {
        RedisBatch batch = RedisBatch.builder()
            .hset("task:1", Map.of("id", "1"))
            .sadd("user:u:tasks", "1")
            .zadd("user:u:tasks:sorted", "1", 42)
            .del("user:u:category:old")
            .build();

        assertThat(batch.getCommands())
            .extracting(RedisBatch.Command::getType)
            .containsExactly(RedisBatch.CommandType.HSET, RedisBatch.CommandType.SADD,
                RedisBatch.CommandType.ZADD, RedisBatch.CommandType.DEL);
        assertEquals(42, batch.getCommands().get(2).getScore());
        assertEquals(List.of("1"), batch.getCommands().get(2).getMembers());
    }

    @Test
    void emptyMembersOrFields_skipped() {
        RedisBatch batch = RedisBatch.builder()
            .sadd("k", List.of())
            .srem("k")
            .hset("h", Map.of())
            .build();

        assertTrue(batch.isEmpty());
        assertEquals(0, batch.size());
    }

    @Test
    void commands_immutable() {
        RedisBatch batch = RedisBatch.builder().sadd("k", "a").build();

        assertThrows(UnsupportedOperationException.class, () -> batch.getCommands().clear());
        assertThrows(UnsupportedOperationException.class, () -> batch.getCommands().get(0).getMembers().add("b"));
    }

    @Test
    void builderReuse_doesNotAffectBuiltBatch() {
        RedisBatch.Builder builder = RedisBatch.builder().sadd("k", "a");
        RedisBatch first = builder.build();

        builder.sadd("k", "b");

        assertEquals(1, first.size());
        assertEquals(2, builder.build().size());
    }
}
