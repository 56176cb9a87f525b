package xyz.firestige.pipeline.exception;

/**
 * 不支持的步骤异常
 * 步骤既不能直接产出动作，也不是可翻译的脚本构建或人工审批
 *
 * @since 1.0
 */
public class UnsupportedStepException extends PipelineCompileException {

    public UnsupportedStepException(String message) {
        super(message, ErrorType.UNSUPPORTED_STEP);
    }

    public UnsupportedStepException(String message, Throwable cause) {
        super(message, ErrorType.UNSUPPORTED_STEP, cause);
    }
}
