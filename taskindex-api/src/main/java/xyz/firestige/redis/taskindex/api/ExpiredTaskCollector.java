package xyz.firestige.redis.taskindex.api;

/**
 * 过期任务回收器
 *
 * <p>由外部调度周期性调用，永久删除软删除时间早于恢复窗口的任务。
 *
 * @since 1.0
 */
public interface ExpiredTaskCollector {

    /**
     * 执行一次回收
     *
     * <p>每个 owner 的批次相互独立，单个批次失败只会跳过，下次回收重试。
     *
     * @return 永久删除的任务数
     * @throws xyz.firestige.redis.taskindex.exception.TaskStorageException 无法枚举 deleted-order
     */
    long sweep();

    /**
     * 最近一次回收结果
     *
     * @return 结果，尚未执行过时返回 {@code null}
     */
    SweepResult getLastResult();
}
