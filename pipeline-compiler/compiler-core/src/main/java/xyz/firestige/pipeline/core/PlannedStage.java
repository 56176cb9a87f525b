package xyz.firestige.pipeline.core;

import java.util.List;

/**
 * 编译结果中的一个 Stage
 *
 * @param name      Stage 名
 * @param container 来源顶层容器 ID
 * @param actions   按调度顺序排列的节点
 */
public record PlannedStage(String name, String container, List<PlannedAction> actions) {

    public PlannedStage {
        actions = List.copyOf(actions);
    }

    /**
     * Stage 内最大的执行顺序，空 Stage 为 0
     */
    public int maxRunOrder() {
        return actions.stream().mapToInt(PlannedAction::runOrder).max().orElse(0);
    }
}
