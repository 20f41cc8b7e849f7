package xyz.firestige.redis.taskindex.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.taskindex.api.ExpiredTaskCollector;
import xyz.firestige.redis.taskindex.api.RedisBatch;
import xyz.firestige.redis.taskindex.api.RedisClient;
import xyz.firestige.redis.taskindex.api.SweepMetricsRecorder;
import xyz.firestige.redis.taskindex.api.SweepResult;
import xyz.firestige.redis.taskindex.exception.TaskStorageException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 过期任务回收器
 *
 * <p>扫描所有 owner 的 deleted-order，删除时间不晚于 {@code now - recoveryWindow} 的任务被永久删除：
 * 任务记录与 deleted-order 成员在同一批次中移除。
 *
 * <p>只操作 deleted-order 和任务记录：已删除的任务不会出现在活跃结构和分类成员中。
 * 单个 owner 的批次失败记录警告后跳过，留待下次回收。
 *
 * @since 1.0
 */
public class RedisExpiredTaskCollector implements ExpiredTaskCollector {

    private static final Logger log = LoggerFactory.getLogger(RedisExpiredTaskCollector.class);

    /** 默认恢复窗口 */
    public static final Duration DEFAULT_RECOVERY_WINDOW = Duration.ofDays(7);

    /** 默认 SCAN COUNT */
    public static final int DEFAULT_SCAN_COUNT = 100;

    private final RedisClient redisClient;
    private final TaskKeys keys;
    private final Clock clock;
    private final Duration recoveryWindow;
    private final int scanCount;
    private final SweepMetricsRecorder metricsRecorder;

    private volatile SweepResult lastResult;

    public RedisExpiredTaskCollector(RedisClient redisClient, TaskKeys keys, Clock clock) {
        this(redisClient, keys, clock, DEFAULT_RECOVERY_WINDOW, DEFAULT_SCAN_COUNT, SweepMetricsRecorder.noop());
    }

    public RedisExpiredTaskCollector(RedisClient redisClient,
                                     TaskKeys keys,
                                     Clock clock,
                                     Duration recoveryWindow,
                                     int scanCount,
                                     SweepMetricsRecorder metricsRecorder) {
        this.redisClient = Objects.requireNonNull(redisClient, "redisClient cannot be null");
        this.keys = Objects.requireNonNull(keys, "keys cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.recoveryWindow = Objects.requireNonNull(recoveryWindow, "recoveryWindow cannot be null");
        if (recoveryWindow.isNegative() || recoveryWindow.isZero()) {
            throw new IllegalArgumentException("recoveryWindow must be positive");
        }
        this.scanCount = scanCount > 0 ? scanCount : DEFAULT_SCAN_COUNT;
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : SweepMetricsRecorder.noop();
    }

    @Override
    public long sweep() {
        long startNanos = System.nanoTime();
        Instant cutoff = clock.instant().minus(recoveryWindow);
        double maxScore = TaskHashCodec.score(cutoff);

        Collection<String> deletedKeys = redisClient.scan(keys.deletedOrderPattern(), scanCount);

        long erased = 0;
        int scanned = 0;
        int failed = 0;
        for (String deletedKey : deletedKeys) {
            if (!keys.isDeletedOrder(deletedKey)) {
                log.debug("跳过非 deleted-order Key: {}", deletedKey);
                continue;
            }
            scanned++;
            try {
                erased += sweepOwner(deletedKey, maxScore);
            } catch (TaskStorageException e) {
                failed++;
                log.warn("回收批次失败，留待下次重试: key={}, error={}", deletedKey, e.getMessage(), e);
            }
        }

        SweepResult result = new SweepResult(cutoff, erased, scanned, failed,
            Duration.ofNanos(System.nanoTime() - startNanos));
        lastResult = result;
        metricsRecorder.record(result);
        log.info("过期任务回收完成: {}", result);
        return erased;
    }

    @Override
    public SweepResult getLastResult() {
        return lastResult;
    }

    public Duration getRecoveryWindow() {
        return recoveryWindow;
    }

    private int sweepOwner(String deletedKey, double maxScore) {
        List<String> expired = redisClient.zrangeByScore(deletedKey, Double.NEGATIVE_INFINITY, maxScore);
        if (expired.isEmpty()) {
            return 0;
        }
        RedisBatch.Builder batch = RedisBatch.builder();
        for (String taskId : expired) {
            batch.del(keys.task(taskId));
        }
        batch.zrem(deletedKey, expired.toArray(new String[0]));
        redisClient.execute(batch.build());
        return expired.size();
    }
}
