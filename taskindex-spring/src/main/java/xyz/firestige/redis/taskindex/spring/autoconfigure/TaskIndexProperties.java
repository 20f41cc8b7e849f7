package xyz.firestige.redis.taskindex.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 任务索引配置属性
 */
@ConfigurationProperties(prefix = "taskindex")
public class TaskIndexProperties {

    /**
     * 是否启用任务索引
     */
    private boolean enabled = true;

    /**
     * Key 命名空间，非空时所有 Key 加 "{prefix}:" 前缀
     */
    private String keyPrefix = "";

    /**
     * 软删除任务的恢复窗口
     */
    private Duration recoveryWindow = Duration.ofDays(7);

    private List list = new List();

    private Sweep sweep = new Sweep();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Duration getRecoveryWindow() {
        return recoveryWindow;
    }

    public void setRecoveryWindow(Duration recoveryWindow) {
        this.recoveryWindow = recoveryWindow;
    }

    public List getList() {
        return list;
    }

    public void setList(List list) {
        this.list = list;
    }

    public Sweep getSweep() {
        return sweep;
    }

    public void setSweep(Sweep sweep) {
        this.sweep = sweep;
    }

    /**
     * 列表查询配置
     */
    public static class List {
        /**
         * 单页 limit 上限
         */
        private int maxLimit = 1000;

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    /**
     * 过期回收配置
     */
    public static class Sweep {
        /**
         * 是否定时执行回收
         */
        private boolean enabled = true;

        /**
         * 两次回收之间的间隔
         */
        private Duration interval = Duration.ofHours(24);

        /**
         * 首次回收前的延迟
         */
        private Duration initialDelay = Duration.ofMinutes(1);

        /**
         * 枚举 deleted-order Key 时的 SCAN COUNT
         */
        private int scanCount = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public int getScanCount() {
            return scanCount;
        }

        public void setScanCount(int scanCount) {
            this.scanCount = scanCount;
        }
    }
}
