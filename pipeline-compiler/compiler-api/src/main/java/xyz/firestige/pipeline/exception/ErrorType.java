package xyz.firestige.pipeline.exception;

/**
 * 编译错误类型枚举
 * 用于区分图结构缺陷、用户配置错误和生命周期误用，便于定位与监控
 *
 * @since 1.0
 */
public enum ErrorType {

    /**
     * 图结构错误（上游分层缺陷，容器节点出现在叶子位置等）
     */
    STRUCTURAL_ERROR("图结构错误"),

    /**
     * 用户配置校验错误
     */
    VALIDATION_ERROR("配置校验错误"),

    /**
     * 不支持的步骤类型
     */
    UNSUPPORTED_STEP("不支持的步骤"),

    /**
     * 生命周期误用（重复编译、编译前读取结果）
     */
    LIFECYCLE_ERROR("生命周期误用");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
