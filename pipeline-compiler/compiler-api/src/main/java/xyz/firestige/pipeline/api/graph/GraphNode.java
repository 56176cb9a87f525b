package xyz.firestige.pipeline.api.graph;

/**
 * 图节点
 * <p>
 * 父节点以 arena 下标保存，不持有反向引用；根节点的 parentIndex 为 -1。
 * 容器节点的 data 为 null。
 *
 * @param index       在 {@link GraphArena} 中的下标
 * @param id          节点 ID，在兄弟节点之间唯一
 * @param parentIndex 父节点下标
 * @param data        叶子负载
 */
public record GraphNode(int index, String id, int parentIndex, NodeData data) {

    public static final int NO_PARENT = -1;

    public boolean isContainer() {
        return data == null;
    }

    public boolean isLeaf() {
        return data != null;
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    @Override
    public String toString() {
        return "GraphNode{" + id + "#" + index + (data != null ? ", " + data.type() : "") + '}';
    }
}
