package xyz.firestige.redis.taskindex.spring.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.taskindex.api.ExpiredTaskCollector;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 过期任务定时回收
 * <p>单线程按固定延迟调用 {@link ExpiredTaskCollector#sweep()}，一次回收失败不影响后续调度
 */
public class ExpiredTaskSweepScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExpiredTaskSweepScheduler.class);

    private final ExpiredTaskCollector collector;
    private final Duration interval;
    private final Duration initialDelay;
    private final ScheduledExecutorService scheduler;

    public ExpiredTaskSweepScheduler(ExpiredTaskCollector collector, Duration interval, Duration initialDelay) {
        this.collector = Objects.requireNonNull(collector, "collector cannot be null");
        this.interval = Objects.requireNonNull(interval, "interval cannot be null");
        this.initialDelay = initialDelay != null ? initialDelay : Duration.ZERO;
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskindex-expiry-sweep");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 启动定时回收
     */
    public void start() {
        scheduler.scheduleWithFixedDelay(
            this::runOnce,
            initialDelay.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("过期任务回收已启动，间隔: {}，首次延迟: {}", interval, initialDelay);
    }

    /**
     * 停止回收
     */
    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("过期任务回收已停止");
    }

    // 异常逃逸会取消后续调度
    void runOnce() {
        try {
            collector.sweep();
        } catch (RuntimeException e) {
            log.error("过期任务回收失败: {}", e.getMessage(), e);
        }
    }
}
