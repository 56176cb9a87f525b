package xyz.firestige.pipeline.exception;

/**
 * 配置校验异常
 * 用户提供的流水线配置不一致（如同一发布组中混合了不同资产类型）
 *
 * @since 1.0
 */
public class PipelineValidationException extends PipelineCompileException {

    public PipelineValidationException(String message) {
        super(message, ErrorType.VALIDATION_ERROR);
    }

    public PipelineValidationException(String message, Throwable cause) {
        super(message, ErrorType.VALIDATION_ERROR, cause);
    }
}
