package xyz.firestige.pipeline.api.graph;

import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.api.blueprint.ManualApprovalStep;
import xyz.firestige.pipeline.exception.ErrorType;
import xyz.firestige.pipeline.exception.PipelineValidationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GraphArenaTest {

    private final GraphArena arena = new GraphArena();

    private NodeData approval(String id) {
        return new NodeData.StepNode(new ManualApprovalStep(id), false);
    }

    @Test
    void addContainer_rootHasNoParent() {
        GraphNode root = arena.addContainer(null, "Root");

        assertThat(root.isRoot()).isTrue();
        assertThat(root.isContainer()).isTrue();
        assertThat(arena.parentOf(root)).isNull();
    }

    @Test
    void addLeaf_parentStoredAsIndex() {
        GraphNode root = arena.addContainer(null, "Root");
        GraphNode stage = arena.addContainer(root, "Prod");
        GraphNode leaf = arena.addLeaf(stage, "Approve", approval("Approve"));

        assertThat(leaf.parentIndex()).isEqualTo(stage.index());
        assertThat(arena.parentOf(leaf)).isSameAs(stage);
        assertThat(arena.node(leaf.index())).isSameAs(leaf);
        assertThat(arena.size()).isEqualTo(3);
    }

    @Test
    void addLeaf_duplicateSiblingId_throws() {
        GraphNode root = arena.addContainer(null, "Root");
        arena.addLeaf(root, "Approve", approval("a"));

        assertThatThrownBy(() -> arena.addLeaf(root, "Approve", approval("b")))
            .isInstanceOf(PipelineValidationException.class)
            .hasMessageContaining("Approve");
    }

    @Test
    void addLeaf_sameIdUnderDifferentParents_allowed() {
        GraphNode root = arena.addContainer(null, "Root");
        GraphNode a = arena.addContainer(root, "A");
        GraphNode b = arena.addContainer(root, "B");

        arena.addLeaf(a, "Deploy", approval("x"));
        arena.addLeaf(b, "Deploy", approval("y"));

        assertThat(arena.size()).isEqualTo(5);
    }

    @Test
    void addChild_underLeaf_throws() {
        GraphNode root = arena.addContainer(null, "Root");
        GraphNode leaf = arena.addLeaf(root, "Leaf", approval("Leaf"));

        assertThatThrownBy(() -> arena.addContainer(leaf, "Child"))
            .isInstanceOf(PipelineValidationException.class);
    }

    @Test
    void addLeaf_duplicateSiblingId_carriesValidationTypeAndParent() {
        GraphNode root = arena.addContainer(null, "Root");
        GraphNode stage = arena.addContainer(root, "Prod");
        arena.addLeaf(stage, "Deploy", approval("a"));

        PipelineValidationException e = assertThrows(PipelineValidationException.class,
            () -> arena.addLeaf(stage, "Deploy", approval("b")));

        assertThat(e.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(e.getContext()).containsEntry("parent", "Prod");
    }

    @Test
    void ancestorPath_fromSharedAncestor() {
        GraphNode root = arena.addContainer(null, "Root");
        GraphNode stage = arena.addContainer(root, "Prod");
        GraphNode stack = arena.addContainer(stage, "Stack1");
        GraphNode leaf = arena.addLeaf(stack, "Deploy", approval("Deploy"));

        assertThat(arena.ancestorPath(leaf, stage)).extracting(GraphNode::id)
            .containsExactly("Stack1", "Deploy");
    }

    @Test
    void ancestorPath_notAnAncestor_returnsFullPath() {
        GraphNode root = arena.addContainer(null, "Root");
        GraphNode a = arena.addContainer(root, "A");
        GraphNode b = arena.addContainer(root, "B");
        GraphNode leaf = arena.addLeaf(a, "Leaf", approval("Leaf"));

        assertThat(arena.ancestorPath(leaf, b)).extracting(GraphNode::id)
            .containsExactly("Root", "A", "Leaf");
    }

    @Test
    void commonAncestor_ofSiblings_isParent() {
        GraphNode root = arena.addContainer(null, "Root");
        GraphNode stage = arena.addContainer(root, "Prod");
        GraphNode s1 = arena.addContainer(stage, "Stack1");
        GraphNode s2 = arena.addContainer(stage, "Stack2");
        GraphNode l1 = arena.addLeaf(s1, "Deploy", approval("d1"));
        GraphNode l2 = arena.addLeaf(s2, "Deploy", approval("d2"));

        assertThat(arena.commonAncestor(List.of(l1, l2))).isSameAs(stage);
    }

    @Test
    void commonAncestor_singleNode_isItsParent() {
        GraphNode root = arena.addContainer(null, "Root");
        GraphNode stage = arena.addContainer(root, "Prod");
        GraphNode leaf = arena.addLeaf(stage, "Approve", approval("Approve"));

        assertThat(arena.commonAncestor(List.of(leaf))).isSameAs(stage);
    }

    @Test
    void commonAncestor_empty_returnsNull() {
        assertThat(arena.commonAncestor(List.of())).isNull();
    }

    @Test
    void foreignNode_rejected() {
        GraphArena other = new GraphArena();
        GraphNode foreign = other.addContainer(null, "Other");
        arena.addContainer(null, "Mine");
        GraphNode fake = new GraphNode(0, "Other", GraphNode.NO_PARENT, null);

        assertThatThrownBy(() -> arena.parentOf(fake)).isInstanceOf(IllegalArgumentException.class);
        assertThat(foreign.index()).isZero();
    }
}
