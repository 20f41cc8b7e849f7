package xyz.firestige.redis.taskindex.spring.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import xyz.firestige.redis.taskindex.api.ExpiredTaskCollector;
import xyz.firestige.redis.taskindex.api.RedisClient;
import xyz.firestige.redis.taskindex.api.SweepResult;
import xyz.firestige.redis.taskindex.exception.TaskStorageException;

/**
 * 任务索引健康检查
 *
 * <p>PING 成功为 UP，否则为 DOWN；附带最近一次回收结果。
 *
 * @since 1.0
 */
public class TaskIndexHealthIndicator implements HealthIndicator {

    private final RedisClient redisClient;
    private final ExpiredTaskCollector collector;

    public TaskIndexHealthIndicator(RedisClient redisClient, ExpiredTaskCollector collector) {
        this.redisClient = redisClient;
        this.collector = collector;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        SweepResult last = collector != null ? collector.getLastResult() : null;
        if (last != null) {
            builder.withDetail("lastSweepCutoff", last.getCutoff().toString())
                .withDetail("lastSweepErased", last.getErasedCount())
                .withDetail("lastSweepScannedOwners", last.getScannedOwners())
                .withDetail("lastSweepFailedOwners", last.getFailedOwners());
        }

        try {
            if (redisClient.ping()) {
                return builder.up().build();
            }
            return builder.down()
                .withDetail("reason", "PING 未返回 PONG")
                .build();
        } catch (TaskStorageException e) {
            return builder.down(e).build();
        }
    }
}
