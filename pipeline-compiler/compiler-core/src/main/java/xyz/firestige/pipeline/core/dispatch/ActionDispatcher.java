package xyz.firestige.pipeline.core.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.blueprint.ManualApprovalStep;
import xyz.firestige.pipeline.api.blueprint.ScriptStep;
import xyz.firestige.pipeline.api.blueprint.Step;
import xyz.firestige.pipeline.api.graph.GraphNode;
import xyz.firestige.pipeline.api.graph.NodeData;
import xyz.firestige.pipeline.api.model.Artifact;
import xyz.firestige.pipeline.api.model.PipelineEnvironment;
import xyz.firestige.pipeline.core.producer.AssetPublishingProducerFactory;
import xyz.firestige.pipeline.core.producer.BuildActionFactory;
import xyz.firestige.pipeline.core.producer.CreateChangeSetProducer;
import xyz.firestige.pipeline.core.producer.ExecuteChangeSetProducer;
import xyz.firestige.pipeline.core.producer.ManualApprovalProducer;
import xyz.firestige.pipeline.core.producer.SelfMutationProducerFactory;
import xyz.firestige.pipeline.core.support.AssemblyContext;
import xyz.firestige.pipeline.core.support.PlaceholderRoleResolver;
import xyz.firestige.pipeline.exception.GraphStructureException;
import xyz.firestige.pipeline.exception.UnsupportedStepException;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 动作分发器
 *
 * <p>按叶子负载类型选择动作生产者：
 * <ul>
 *   <li>GROUP / STACK_GROUP：分层缺陷，抛出 {@link GraphStructureException}</li>
 *   <li>SELF_UPDATE：自更新构建动作</li>
 *   <li>PUBLISH_ASSETS：资产发布构建动作（登记发布角色并取得共享角色）</li>
 *   <li>PREPARE / EXECUTE：创建 / 执行变更集</li>
 *   <li>STEP：步骤自身实现 {@link ActionProducer} 时直接委托，否则适配脚本构建或人工审批</li>
 * </ul>
 *
 * @since 1.0
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    /** 合成步骤的构建项目逻辑 ID */
    public static final String SYNTH_CONSTRUCT_ID = "CdkBuildProject";

    private final SelfMutationProducerFactory selfMutation;
    private final AssetPublishingProducerFactory assetPublishing;
    private final AssemblyContext assembly;
    private final PlaceholderRoleResolver roles;
    private final PipelineEnvironment environment;
    private final Supplier<Artifact> cloudAssemblyArtifact;

    public ActionDispatcher(SelfMutationProducerFactory selfMutation,
                            AssetPublishingProducerFactory assetPublishing,
                            AssemblyContext assembly,
                            PlaceholderRoleResolver roles,
                            PipelineEnvironment environment,
                            Supplier<Artifact> cloudAssemblyArtifact) {
        this.selfMutation = Objects.requireNonNull(selfMutation, "selfMutation cannot be null");
        this.assetPublishing = Objects.requireNonNull(assetPublishing, "assetPublishing cannot be null");
        this.assembly = Objects.requireNonNull(assembly, "assembly cannot be null");
        this.roles = Objects.requireNonNull(roles, "roles cannot be null");
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.cloudAssemblyArtifact = Objects.requireNonNull(cloudAssemblyArtifact, "cloudAssemblyArtifact cannot be null");
    }

    /**
     * 为叶子节点选择动作生产者
     *
     * @throws GraphStructureException  节点是容器
     * @throws UnsupportedStepException 步骤类型无法转换
     */
    public ActionProducer dispatch(GraphNode node) {
        NodeData data = node.data();
        if (data == null) {
            throw new GraphStructureException("Unexpected container at scheduling time: " + node.id())
                .addContext("node", node.id());
        }
        log.debug("Dispatching node {} ({})", node.id(), data.type());

        return switch (data.type()) {
            case GROUP, STACK_GROUP -> throw new GraphStructureException(
                "Unexpected group node at scheduling time: " + node.id())
                .addContext("node", node.id())
                .addContext("type", data.type());
            case SELF_UPDATE -> selfMutation.create();
            case PUBLISH_ASSETS -> assetPublishing.create(node.id(), ((NodeData.PublishAssets) data).assets());
            case PREPARE -> new CreateChangeSetProducer(((NodeData.Prepare) data).stack(),
                cloudAssemblyArtifact.get(), assembly, environment, roles);
            case EXECUTE -> {
                NodeData.Execute execute = (NodeData.Execute) data;
                yield new ExecuteChangeSetProducer(execute.stack(), execute.captureOutputs(), environment, roles);
            }
            case STEP -> fromStep((NodeData.StepNode) data);
        };
    }

    private ActionProducer fromStep(NodeData.StepNode data) {
        Step step = data.step();
        if (step instanceof ActionProducer producer) {
            return producer;
        }
        if (step instanceof ScriptStep script) {
            String constructId = data.isBuildStep() ? SYNTH_CONSTRUCT_ID : step.getId();
            return new BuildActionFactory(constructId, script, assembly);
        }
        if (step instanceof ManualApprovalStep approval) {
            return new ManualApprovalProducer(approval);
        }
        throw new UnsupportedStepException(
            "Deployment step '" + step + "' is not supported for this pipeline")
            .addContext("step", step.getId());
    }
}
