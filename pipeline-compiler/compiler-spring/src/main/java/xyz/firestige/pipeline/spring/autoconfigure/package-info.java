/**
 * Spring Boot 自动配置
 * <p>
 * 为流水线编译器提供 Spring Boot 自动装配支持。
 * <p>
 * 核心组件：
 * <ul>
 *   <li>{@link xyz.firestige.pipeline.spring.autoconfigure.PipelineCompilerAutoConfiguration} - 自动配置类</li>
 *   <li>{@link xyz.firestige.pipeline.spring.autoconfigure.PipelineCompilerProperties} - 配置属性</li>
 * </ul>
 * <p>
 * 使用方式：
 * <pre>
 * # application.yml
 * pipeline:
 *   compiler:
 *     enabled: true
 *     pipeline-name: my-pipeline
 *     assembly-root: cdk.out
 *     environment:
 *       account: "111111111111"
 *       region: us-east-1
 * </pre>
 *
 * @since 1.0
 */
package xyz.firestige.pipeline.spring.autoconfigure;
