package xyz.firestige.pipeline.api.graph;

import xyz.firestige.pipeline.exception.PipelineValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 图节点仓库
 *
 * <p>所有节点按插入顺序保存在列表中，以整数下标寻址。父子关系只通过下标表达，
 * 祖先路径和公共祖先的计算都是对下标的纯遍历，不存在引用环。
 *
 * <p>非线程安全，构图完成后只读。
 *
 * @since 1.0
 */
public class GraphArena {

    private final List<GraphNode> nodes = new ArrayList<>();
    private final Map<Integer, Set<String>> childIds = new HashMap<>();

    /**
     * 添加容器节点
     *
     * @param parent 父节点，null 表示根
     */
    public GraphNode addContainer(GraphNode parent, String id) {
        return add(parent, id, null);
    }

    /**
     * 添加叶子节点
     *
     * @param parent 父节点，null 表示根
     */
    public GraphNode addLeaf(GraphNode parent, String id, NodeData data) {
        Objects.requireNonNull(data, "data cannot be null");
        return add(parent, id, data);
    }

    private GraphNode add(GraphNode parent, String id, NodeData data) {
        Objects.requireNonNull(id, "id cannot be null");
        int parentIndex = GraphNode.NO_PARENT;
        if (parent != null) {
            checkOwned(parent);
            if (parent.isLeaf()) {
                throw new PipelineValidationException("Cannot add child '" + id + "' to leaf node")
                    .addContext("parent", parent.id());
            }
            parentIndex = parent.index();
        }
        if (!childIds.computeIfAbsent(parentIndex, k -> new HashSet<>()).add(id)) {
            throw new PipelineValidationException("Duplicate node id among siblings: " + id)
                .addContext("parent", parent != null ? parent.id() : "<root>");
        }
        GraphNode node = new GraphNode(nodes.size(), id, parentIndex, data);
        nodes.add(node);
        return node;
    }

    public GraphNode node(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("No graph node at index " + index);
        }
        return nodes.get(index);
    }

    /**
     * @return 父节点，根节点返回 null
     */
    public GraphNode parentOf(GraphNode node) {
        checkOwned(node);
        return node.isRoot() ? null : nodes.get(node.parentIndex());
    }

    /**
     * 从根到该节点（含）的路径
     */
    public List<GraphNode> rootPath(GraphNode node) {
        checkOwned(node);
        List<GraphNode> path = new ArrayList<>();
        for (GraphNode cur = node; cur != null; cur = parentOf(cur)) {
            path.add(cur);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * 从 ancestor 的下一层到 node（含）的路径
     * <p>
     * 若 ancestor 为 null 或不是 node 的祖先，返回从根开始的完整路径。
     */
    public List<GraphNode> ancestorPath(GraphNode node, GraphNode ancestor) {
        List<GraphNode> full = rootPath(node);
        if (ancestor == null) {
            return full;
        }
        for (int i = 0; i < full.size(); i++) {
            if (full.get(i).index() == ancestor.index()) {
                return new ArrayList<>(full.subList(i + 1, full.size()));
            }
        }
        return full;
    }

    /**
     * 所有给定节点的最深公共祖先
     * <p>
     * 结果一定是每个节点的真祖先（不会是节点本身），因此单个节点的公共祖先是其父节点。
     *
     * @return 公共祖先，节点集合为空或没有共同的根时返回 null
     */
    public GraphNode commonAncestor(Collection<GraphNode> group) {
        Iterator<GraphNode> it = group.iterator();
        if (!it.hasNext()) {
            return null;
        }
        List<GraphNode> first = rootPath(it.next());
        List<GraphNode> prefix = first.subList(0, first.size() - 1);
        while (it.hasNext() && !prefix.isEmpty()) {
            List<GraphNode> other = rootPath(it.next());
            int limit = Math.min(prefix.size(), other.size() - 1);
            int common = 0;
            while (common < limit && prefix.get(common).index() == other.get(common).index()) {
                common++;
            }
            prefix = prefix.subList(0, common);
        }
        return prefix.isEmpty() ? null : prefix.get(prefix.size() - 1);
    }

    public int size() {
        return nodes.size();
    }

    private void checkOwned(GraphNode node) {
        Objects.requireNonNull(node, "node cannot be null");
        if (node.index() < 0 || node.index() >= nodes.size() || nodes.get(node.index()) != node) {
            throw new IllegalArgumentException("Node " + node + " does not belong to this arena");
        }
    }
}
