package xyz.firestige.pipeline.api.graph;

import java.util.List;
import java.util.Objects;

/**
 * 顶层容器及其分层后的叶子
 *
 * @param node     容器节点
 * @param tranches 已分层的叶子：外层按执行先后排列，同一层内节点之间没有依赖
 */
public record GraphContainer(GraphNode node, List<List<GraphNode>> tranches) {

    public GraphContainer {
        Objects.requireNonNull(node, "node cannot be null");
        tranches = tranches == null ? List.of() : tranches.stream().map(List::copyOf).toList();
    }

    public String id() {
        return node.id();
    }

    public List<List<GraphNode>> sortedLeaves() {
        return tranches;
    }
}
