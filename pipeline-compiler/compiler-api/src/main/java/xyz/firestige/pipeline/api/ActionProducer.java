package xyz.firestige.pipeline.api;

/**
 * 动作生产者
 * <p>
 * 把一个图叶子节点落地为流水线阶段中的一个或多个动作。步骤类若直接实现该接口，
 * 编译器会跳过内置适配直接委托给它。
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ActionProducer {

    /**
     * 向 {@link ProduceOptions#stage()} 中添加动作
     *
     * @param options 当前阶段、动作名、执行顺序等上下文
     * @return 占用的执行顺序槽位数以及可能创建的构建项目
     */
    ProduceResult produce(ProduceOptions options);
}
