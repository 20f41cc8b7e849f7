package xyz.firestige.redis.taskindex.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import xyz.firestige.redis.taskindex.api.SweepMetricsRecorder;
import xyz.firestige.redis.taskindex.api.SweepResult;

/**
 * 基于 Micrometer 的回收指标记录器
 * <p>
 * 记录以下指标：
 * - taskindex_sweep_runs: 回收执行次数
 * - taskindex_sweep_erased: 永久删除的任务数
 * - taskindex_sweep_failed_batches: 失败并跳过的 owner 批次数
 * - taskindex_sweep_duration: 单次回收耗时
 *
 * @since 1.0
 */
public class MicrometerSweepMetricsRecorder implements SweepMetricsRecorder {

    private final Counter runs;
    private final Counter erased;
    private final Counter failedBatches;
    private final Timer duration;

    public MicrometerSweepMetricsRecorder(MeterRegistry registry) {
        this.runs = Counter.builder("taskindex_sweep_runs")
            .description("Expired task sweep runs")
            .register(registry);
        this.erased = Counter.builder("taskindex_sweep_erased")
            .description("Tasks permanently erased by the sweep")
            .register(registry);
        this.failedBatches = Counter.builder("taskindex_sweep_failed_batches")
            .description("Owner batches skipped after a storage failure")
            .register(registry);
        this.duration = Timer.builder("taskindex_sweep_duration")
            .description("Expired task sweep duration")
            .register(registry);
    }

    @Override
    public void record(SweepResult result) {
        runs.increment();
        erased.increment(result.getErasedCount());
        failedBatches.increment(result.getFailedOwners());
        duration.record(result.getElapsed());
    }
}
