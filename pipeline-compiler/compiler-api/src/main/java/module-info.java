/**
 * 流水线编译器 API 模块
 * <p>
 * 分层依赖图、步骤定义、流水线模型与动作生产者 SPI。
 */
module xyz.firestige.pipeline.api {
    // 导出核心 API
    exports xyz.firestige.pipeline.api;
    exports xyz.firestige.pipeline.api.blueprint;
    exports xyz.firestige.pipeline.api.credential;
    exports xyz.firestige.pipeline.api.graph;
    exports xyz.firestige.pipeline.api.model;

    // 导出异常包
    exports xyz.firestige.pipeline.exception;

    requires java.base;
}
