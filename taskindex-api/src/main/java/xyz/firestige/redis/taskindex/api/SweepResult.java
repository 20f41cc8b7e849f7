package xyz.firestige.redis.taskindex.api;

import java.time.Duration;
import java.time.Instant;

/**
 * 回收结果（不可变）
 *
 * @since 1.0
 */
public final class SweepResult {

    private final Instant cutoff;
    private final long erasedCount;
    private final int scannedOwners;
    private final int failedOwners;
    private final Duration elapsed;

    public SweepResult(Instant cutoff, long erasedCount, int scannedOwners, int failedOwners, Duration elapsed) {
        this.cutoff = cutoff;
        this.erasedCount = erasedCount;
        this.scannedOwners = scannedOwners;
        this.failedOwners = failedOwners;
        this.elapsed = elapsed;
    }

    /** 删除时间不晚于此刻的任务被回收 */
    public Instant getCutoff() {
        return cutoff;
    }

    public long getErasedCount() {
        return erasedCount;
    }

    public int getScannedOwners() {
        return scannedOwners;
    }

    public int getFailedOwners() {
        return failedOwners;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "SweepResult{cutoff=" + cutoff + ", erased=" + erasedCount + ", scannedOwners=" + scannedOwners
            + ", failedOwners=" + failedOwners + ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
