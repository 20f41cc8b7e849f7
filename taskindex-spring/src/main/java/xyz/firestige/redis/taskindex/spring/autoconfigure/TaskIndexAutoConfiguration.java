package xyz.firestige.redis.taskindex.spring.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.redis.taskindex.api.ExpiredTaskCollector;
import xyz.firestige.redis.taskindex.api.RedisClient;
import xyz.firestige.redis.taskindex.api.SweepMetricsRecorder;
import xyz.firestige.redis.taskindex.api.TaskIndexMaintainer;
import xyz.firestige.redis.taskindex.api.TaskQueryEngine;
import xyz.firestige.redis.taskindex.api.TaskService;
import xyz.firestige.redis.taskindex.core.DefaultTaskService;
import xyz.firestige.redis.taskindex.core.RedisExpiredTaskCollector;
import xyz.firestige.redis.taskindex.core.RedisTaskIndexMaintainer;
import xyz.firestige.redis.taskindex.core.RedisTaskQueryEngine;
import xyz.firestige.redis.taskindex.core.TaskKeys;
import xyz.firestige.redis.taskindex.spring.health.TaskIndexHealthIndicator;
import xyz.firestige.redis.taskindex.spring.metrics.MicrometerSweepMetricsRecorder;
import xyz.firestige.redis.taskindex.spring.redis.SpringRedisClient;
import xyz.firestige.redis.taskindex.spring.scheduling.ExpiredTaskSweepScheduler;

import java.time.Clock;
import java.util.UUID;

/**
 * 任务索引自动配置
 *
 * @since 1.0
 */
@AutoConfiguration(
    after = RedisAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
)
@ConditionalOnClass({StringRedisTemplate.class, TaskService.class})
@ConditionalOnProperty(prefix = "taskindex", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TaskIndexProperties.class)
public class TaskIndexAutoConfiguration {

    /**
     * 时间源，测试中可替换为固定时钟
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock taskIndexClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskKeys taskKeys(TaskIndexProperties properties) {
        return new TaskKeys(properties.getKeyPrefix());
    }

    /**
     * RedisClient Bean（基于 Spring StringRedisTemplate）
     */
    @Bean(name = "taskIndexRedisClient")
    @ConditionalOnMissingBean(RedisClient.class)
    public RedisClient taskIndexRedisClient(StringRedisTemplate redisTemplate) {
        return new SpringRedisClient(redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskIndexMaintainer taskIndexMaintainer(RedisClient redisClient, TaskKeys keys, Clock clock) {
        return new RedisTaskIndexMaintainer(redisClient, keys, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskQueryEngine taskQueryEngine(RedisClient redisClient, TaskKeys keys, TaskIndexProperties properties) {
        return new RedisTaskQueryEngine(redisClient, keys, properties.getList().getMaxLimit());
    }

    /**
     * 过期回收器，存在 MeterRegistry 时记录 Micrometer 指标
     */
    @Bean
    @ConditionalOnMissingBean
    public ExpiredTaskCollector expiredTaskCollector(RedisClient redisClient,
                                                     TaskKeys keys,
                                                     Clock clock,
                                                     TaskIndexProperties properties,
                                                     ObjectProvider<SweepMetricsRecorder> recorderProvider) {
        return new RedisExpiredTaskCollector(
            redisClient,
            keys,
            clock,
            properties.getRecoveryWindow(),
            properties.getSweep().getScanCount(),
            recorderProvider.getIfAvailable(SweepMetricsRecorder::noop)
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskService taskService(TaskIndexMaintainer maintainer,
                                   TaskQueryEngine queryEngine,
                                   Clock clock,
                                   TaskIndexProperties properties) {
        return new DefaultTaskService(maintainer, queryEngine, clock, properties.getRecoveryWindow(),
            () -> UUID.randomUUID().toString());
    }

    /**
     * 定时回收
     */
    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "taskindex.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ExpiredTaskSweepScheduler expiredTaskSweepScheduler(ExpiredTaskCollector collector,
                                                               TaskIndexProperties properties) {
        ExpiredTaskSweepScheduler scheduler = new ExpiredTaskSweepScheduler(
            collector,
            properties.getSweep().getInterval(),
            properties.getSweep().getInitialDelay()
        );
        scheduler.start();
        return scheduler;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MeterRegistry.class)
        public SweepMetricsRecorder sweepMetricsRecorder(MeterRegistry registry) {
            return new MicrometerSweepMetricsRecorder(registry);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthConfiguration {

        /**
         * 健康检查指示器
         */
        @Bean
        @ConditionalOnMissingBean
        public TaskIndexHealthIndicator taskIndexHealthIndicator(RedisClient redisClient,
                                                                 ExpiredTaskCollector collector) {
            return new TaskIndexHealthIndicator(redisClient, collector);
        }
    }
}
