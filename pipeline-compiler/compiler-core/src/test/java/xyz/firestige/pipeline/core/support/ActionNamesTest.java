package xyz.firestige.pipeline.core.support;

import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.api.graph.GraphArena;
import xyz.firestige.pipeline.api.graph.GraphNode;
import xyz.firestige.pipeline.api.graph.NodeData;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionNamesTest {

    @Test
    void of_pathBelowSharedParent() {
        GraphArena arena = new GraphArena();
        GraphNode root = arena.addContainer(null, "Pipeline");
        GraphNode prod = arena.addContainer(root, "Prod");
        GraphNode stack = arena.addContainer(prod, "Api Stack");
        GraphNode prepare = arena.addLeaf(stack, "Prepare", new NodeData.SelfUpdate());
        GraphNode deploy = arena.addLeaf(stack, "Deploy", new NodeData.SelfUpdate());

        GraphNode shared = arena.commonAncestor(List.of(prepare, deploy));

        assertEquals("Prepare", ActionNames.of(arena, prepare, shared));
        assertEquals("Api_Stack.Prepare", ActionNames.of(arena, prepare, prod));
    }

    @Test
    void sanitize_keepsAllowedCharacters() {
        assertEquals("a.b@c-d_e", ActionNames.sanitize("a.b@c-d_e"));
        assertEquals("my_stack_1_", ActionNames.sanitize("my stack/1!"));
    }
}
