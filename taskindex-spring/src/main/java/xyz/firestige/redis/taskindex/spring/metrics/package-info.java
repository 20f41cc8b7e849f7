/**
 * Micrometer 指标集成
 *
 * @since 1.0
 */
package xyz.firestige.redis.taskindex.spring.metrics;
