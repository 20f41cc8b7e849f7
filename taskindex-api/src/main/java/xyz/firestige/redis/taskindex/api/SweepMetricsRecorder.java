package xyz.firestige.redis.taskindex.api;

/**
 * 回收指标记录器接口
 * <p>
 * 允许接入 Micrometer 或其他监控系统
 *
 * @since 1.0
 */
@FunctionalInterface
public interface SweepMetricsRecorder {

    /**
     * 记录一次回收结果
     *
     * @param result 回收结果
     */
    void record(SweepResult result);

    /**
     * 空操作实现（默认）
     *
     * @return 不执行任何操作的记录器
     */
    static SweepMetricsRecorder noop() {
        return result -> {};
    }
}
