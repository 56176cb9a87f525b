package xyz.firestige.pipeline.exception;

/**
 * 重复编译异常
 * 同一个编译器实例只能编译一次
 *
 * @since 1.0
 */
public class AlreadyBuiltException extends PipelineCompileException {

    public AlreadyBuiltException(String message) {
        super(message, ErrorType.LIFECYCLE_ERROR);
    }
}
