/**
 * 流水线编译器 Core 模块
 * <p>
 * 编译器实现：tranche 切分、执行顺序分配、动作分派、共享角色缓存与各类动作生产者。
 * 不依赖 Spring。
 */
module xyz.firestige.pipeline.core {
    exports xyz.firestige.pipeline.core;
    exports xyz.firestige.pipeline.core.cache;
    exports xyz.firestige.pipeline.core.dispatch;
    exports xyz.firestige.pipeline.core.layout;
    exports xyz.firestige.pipeline.core.producer;
    exports xyz.firestige.pipeline.core.support;

    // 依赖 API 模块
    requires transitive xyz.firestige.pipeline.api;

    // 依赖外部库
    requires com.fasterxml.jackson.databind;
    requires org.slf4j;
}
