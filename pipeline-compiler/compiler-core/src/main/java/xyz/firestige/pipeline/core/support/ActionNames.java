package xyz.firestige.pipeline.core.support;

import xyz.firestige.pipeline.api.graph.GraphArena;
import xyz.firestige.pipeline.api.graph.GraphNode;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 动作命名
 * <p>
 * 动作名为节点相对于 Stage 公共祖先的路径，每段清洗后以 "." 连接。
 */
public final class ActionNames {

    private static final Pattern ILLEGAL_CHARS = Pattern.compile("[^A-Za-z0-9.@\\-_]");

    private ActionNames() {
    }

    public static String of(GraphArena arena, GraphNode node, GraphNode sharedParent) {
        return arena.ancestorPath(node, sharedParent).stream()
            .map(GraphNode::id)
            .map(ActionNames::sanitize)
            .collect(Collectors.joining("."));
    }

    public static String sanitize(String segment) {
        return ILLEGAL_CHARS.matcher(segment).replaceAll("_");
    }
}
