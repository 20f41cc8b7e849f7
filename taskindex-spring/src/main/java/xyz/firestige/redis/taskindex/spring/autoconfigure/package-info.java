/**
 * Spring Boot 自动配置
 * <p>
 * 核心组件：
 * <ul>
 *   <li>{@link xyz.firestige.redis.taskindex.spring.autoconfigure.TaskIndexAutoConfiguration} - 自动配置类</li>
 *   <li>{@link xyz.firestige.redis.taskindex.spring.autoconfigure.TaskIndexProperties} - 配置属性</li>
 * </ul>
 * <p>
 * 使用方式：
 * <pre>
 * # application.yml
 * taskindex:
 *   enabled: true
 *   key-prefix: todo
 *   recovery-window: 7d
 *   list:
 *     max-limit: 1000
 *   sweep:
 *     enabled: true
 *     interval: 24h
 *     initial-delay: 1m
 *     scan-count: 100
 * </pre>
 *
 * @since 1.0
 */
package xyz.firestige.redis.taskindex.spring.autoconfigure;
