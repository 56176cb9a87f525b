package xyz.firestige.pipeline.api;

import xyz.firestige.pipeline.api.model.BuildProject;

/**
 * 动作生产结果
 *
 * @param runOrdersConsumed 占用的执行顺序槽位数，非负
 * @param project           生产过程中创建的构建项目，可为 null
 */
public record ProduceResult(int runOrdersConsumed, BuildProject project) {

    public ProduceResult {
        if (runOrdersConsumed < 0) {
            throw new IllegalArgumentException("runOrdersConsumed cannot be negative: " + runOrdersConsumed);
        }
    }

    public static ProduceResult of(int runOrdersConsumed) {
        return new ProduceResult(runOrdersConsumed, null);
    }

    public static ProduceResult of(int runOrdersConsumed, BuildProject project) {
        return new ProduceResult(runOrdersConsumed, project);
    }

    public boolean hasProject() {
        return project != null;
    }
}
