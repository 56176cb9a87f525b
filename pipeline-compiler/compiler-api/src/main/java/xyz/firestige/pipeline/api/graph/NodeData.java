package xyz.firestige.pipeline.api.graph;

import xyz.firestige.pipeline.api.blueprint.StackAsset;
import xyz.firestige.pipeline.api.blueprint.StackDeployment;
import xyz.firestige.pipeline.api.blueprint.Step;

import java.util.List;
import java.util.Objects;

/**
 * 图节点负载
 * <p>
 * 每种负载对应一个 record，通过 {@link #type()} 区分，调度方对 {@link NodeType} 做穷举 switch。
 *
 * @since 1.0
 */
public interface NodeData {

    NodeType type();

    record Group() implements NodeData {
        @Override
        public NodeType type() {
            return NodeType.GROUP;
        }
    }

    record StackGroup() implements NodeData {
        @Override
        public NodeType type() {
            return NodeType.STACK_GROUP;
        }
    }

    record SelfUpdate() implements NodeData {
        @Override
        public NodeType type() {
            return NodeType.SELF_UPDATE;
        }
    }

    /**
     * @param assets 待发布资产，按声明顺序
     */
    record PublishAssets(List<StackAsset> assets) implements NodeData {
        public PublishAssets {
            assets = assets == null ? List.of() : List.copyOf(assets);
        }

        @Override
        public NodeType type() {
            return NodeType.PUBLISH_ASSETS;
        }
    }

    record Prepare(StackDeployment stack) implements NodeData {
        public Prepare {
            Objects.requireNonNull(stack, "stack cannot be null");
        }

        @Override
        public NodeType type() {
            return NodeType.PREPARE;
        }
    }

    record Execute(StackDeployment stack, boolean captureOutputs) implements NodeData {
        public Execute {
            Objects.requireNonNull(stack, "stack cannot be null");
        }

        @Override
        public NodeType type() {
            return NodeType.EXECUTE;
        }
    }

    /**
     * @param step        用户步骤
     * @param isBuildStep 是否为合成（synth）步骤
     */
    record StepNode(Step step, boolean isBuildStep) implements NodeData {
        public StepNode {
            Objects.requireNonNull(step, "step cannot be null");
        }

        @Override
        public NodeType type() {
            return NodeType.STEP;
        }
    }
}
