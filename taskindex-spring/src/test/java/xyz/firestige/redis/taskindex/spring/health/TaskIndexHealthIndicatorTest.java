package xyz.firestige.redis.taskindex.spring.health;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import xyz.firestige.redis.taskindex.api.ExpiredTaskCollector;
import xyz.firestige.redis.taskindex.api.SweepResult;
import xyz.firestige.redis.taskindex.spring.StubRedisClient;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TaskIndexHealthIndicatorTest {

    private static ExpiredTaskCollector collectorWith(SweepResult last) {
        return new ExpiredTaskCollector() {
            @Override
            public long sweep() {
                return 0;
            }

            @Override
            public SweepResult getLastResult() {
                return last;
            }
        };
    }

    @Test
    void health_reachable_up() {
        Health health = new TaskIndexHealthIndicator(new StubRedisClient(), collectorWith(null)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).doesNotContainKey("lastSweepErased");
    }

    @Test
    void health_includesLastSweep() {
        SweepResult last = new SweepResult(Instant.parse("2024-03-01T00:00:00Z"), 4, 2, 1, Duration.ofMillis(5));

        Health health = new TaskIndexHealthIndicator(new StubRedisClient(), collectorWith(last)).health();

        assertThat(health.getDetails())
            .containsEntry("lastSweepCutoff", "2024-03-01T00:00:00Z")
            .containsEntry("lastSweepErased", 4L)
            .containsEntry("lastSweepScannedOwners", 2)
            .containsEntry("lastSweepFailedOwners", 1);
    }

    @Test
    void health_unreachable_down() {
        StubRedisClient client = new StubRedisClient();
        client.setReachable(false);

        Health health = new TaskIndexHealthIndicator(client, collectorWith(null)).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("error").toString()).contains("connection refused");
    }
}
