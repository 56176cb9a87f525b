/**
 * 流水线编译器 Spring Boot 集成模块
 * <p>
 * 提供自动配置、属性绑定与 Micrometer 指标。
 */
module xyz.firestige.pipeline.spring {
    exports xyz.firestige.pipeline.spring.autoconfigure;
    exports xyz.firestige.pipeline.spring.metrics;

    requires transitive xyz.firestige.pipeline.api;
    requires transitive xyz.firestige.pipeline.core;

    // Spring Boot 依赖
    requires spring.boot;
    requires spring.boot.autoconfigure;
    requires spring.context;
    requires spring.beans;
    requires com.fasterxml.jackson.databind;

    // Micrometer（可选）
    requires static micrometer.core;

    // 允许 Spring 进行反射访问
    opens xyz.firestige.pipeline.spring.autoconfigure to spring.core, spring.beans;
}
