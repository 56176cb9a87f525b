package xyz.firestige.pipeline.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 流水线编译基础异常
 * 所有编译相关异常的基类，编译过程不做任何内部重试
 *
 * <p>上下文信息（节点 ID、Stage 名称、资产类别等）通过 {@link #addContext(String, Object)} 逐层补充，
 * 并追加到异常消息末尾，便于调用方定位出错的图元素。
 *
 * @since 1.0
 */
public class PipelineCompileException extends RuntimeException {

    /**
     * 错误类型
     */
    private final ErrorType errorType;

    /**
     * 上下文信息
     */
    private final Map<String, Object> context = new LinkedHashMap<>();

    public PipelineCompileException(String message, ErrorType errorType) {
        super(message);
        this.errorType = errorType;
    }

    public PipelineCompileException(String message, ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    /**
     * 添加上下文信息（已存在的键不覆盖，保留最内层的值）
     */
    public PipelineCompileException addContext(String key, Object value) {
        this.context.putIfAbsent(key, value);
        return this;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (context.isEmpty()) {
            return message;
        }
        String details = context.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
        return message + " [" + details + "]";
    }
}
