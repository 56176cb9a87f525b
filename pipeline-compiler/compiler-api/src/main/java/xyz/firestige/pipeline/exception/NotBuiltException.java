package xyz.firestige.pipeline.exception;

/**
 * 未编译异常
 * 在编译完成之前读取编译产物时抛出
 *
 * @since 1.0
 */
public class NotBuiltException extends PipelineCompileException {

    public NotBuiltException(String message) {
        super(message, ErrorType.LIFECYCLE_ERROR);
    }
}
