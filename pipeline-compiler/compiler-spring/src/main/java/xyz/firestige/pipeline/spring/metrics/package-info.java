/**
 * Micrometer 指标集成
 * <p>
 * 提供基于 Micrometer 的编译指标记录实现。
 *
 * @since 1.0
 */
package xyz.firestige.pipeline.spring.metrics;
