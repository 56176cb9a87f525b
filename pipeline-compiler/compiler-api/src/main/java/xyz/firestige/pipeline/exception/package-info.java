/**
 * 流水线编译异常类型
 * <ul>
 *   <li>{@link xyz.firestige.pipeline.exception.PipelineCompileException} - 基础异常</li>
 *   <li>{@link xyz.firestige.pipeline.exception.GraphStructureException} - 图结构异常</li>
 *   <li>{@link xyz.firestige.pipeline.exception.PipelineValidationException} - 配置校验异常</li>
 *   <li>{@link xyz.firestige.pipeline.exception.UnsupportedStepException} - 不支持的步骤</li>
 *   <li>{@link xyz.firestige.pipeline.exception.AlreadyBuiltException} / {@link xyz.firestige.pipeline.exception.NotBuiltException} - 生命周期误用</li>
 * </ul>
 *
 * @since 1.0
 */
package xyz.firestige.pipeline.exception;
