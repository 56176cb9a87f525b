package xyz.firestige.pipeline.core.dispatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.ProduceOptions;
import xyz.firestige.pipeline.api.ProduceResult;
import xyz.firestige.pipeline.api.blueprint.FileSet;
import xyz.firestige.pipeline.api.blueprint.ManualApprovalStep;
import xyz.firestige.pipeline.api.blueprint.ScriptStep;
import xyz.firestige.pipeline.api.blueprint.StackDeployment;
import xyz.firestige.pipeline.api.blueprint.Step;
import xyz.firestige.pipeline.api.graph.GraphArena;
import xyz.firestige.pipeline.api.graph.GraphNode;
import xyz.firestige.pipeline.api.graph.NodeData;
import xyz.firestige.pipeline.api.model.ActionCategory;
import xyz.firestige.pipeline.api.model.Artifact;
import xyz.firestige.pipeline.api.model.ArtifactStore;
import xyz.firestige.pipeline.api.model.PipelineStage;
import xyz.firestige.pipeline.core.CompilerOptions;
import xyz.firestige.pipeline.core.cache.AssetRoleCache;
import xyz.firestige.pipeline.core.producer.AssetPublishingProducerFactory;
import xyz.firestige.pipeline.core.producer.BuildActionFactory;
import xyz.firestige.pipeline.core.producer.CreateChangeSetProducer;
import xyz.firestige.pipeline.core.producer.ExecuteChangeSetProducer;
import xyz.firestige.pipeline.core.producer.ManualApprovalProducer;
import xyz.firestige.pipeline.core.producer.SelfMutationProducerFactory;
import xyz.firestige.pipeline.core.support.ArtifactMap;
import xyz.firestige.pipeline.core.support.AssemblyContext;
import xyz.firestige.pipeline.core.support.PlaceholderRoleResolver;
import xyz.firestige.pipeline.exception.ErrorType;
import xyz.firestige.pipeline.exception.GraphStructureException;
import xyz.firestige.pipeline.exception.UnsupportedStepException;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.firestige.pipeline.core.CompilerFixtures.ENV;
import static xyz.firestige.pipeline.core.CompilerFixtures.assembly;
import static xyz.firestige.pipeline.core.CompilerFixtures.options;
import static xyz.firestige.pipeline.core.CompilerFixtures.produceOptions;

class ActionDispatcherTest {

    @TempDir
    Path root;

    private GraphArena arena;
    private GraphNode stageNode;
    private ActionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        CompilerOptions options = options(root).build();
        AssemblyContext assembly = assembly(root);
        FileSet cloudAssembly = new FileSet("CloudAssembly");
        PlaceholderRoleResolver roles = new PlaceholderRoleResolver(ENV);
        AssetRoleCache roleCache = new AssetRoleCache(ENV, new ArtifactStore("bucket", ENV), List.of(),
            () -> null, roles);
        dispatcher = new ActionDispatcher(
            new SelfMutationProducerFactory(options, cloudAssembly, assembly),
            new AssetPublishingProducerFactory(options, cloudAssembly, assembly, roleCache),
            assembly, roles, ENV, () -> new Artifact("Synth_Output"));

        arena = new GraphArena();
        stageNode = arena.addContainer(arena.addContainer(null, "Pipeline"), "Prod");
    }

    private StackDeployment stack() {
        return StackDeployment.builder("ProdApi", "Prod-Api")
            .absoluteTemplatePath(root.resolve("ProdApi.template.json"))
            .build();
    }

    /** 自带生产逻辑的步骤 */
    static class CustomStep extends Step implements ActionProducer {

        CustomStep(String id) {
            super(id);
        }

        @Override
        public ProduceResult produce(ProduceOptions options) {
            return ProduceResult.of(0);
        }
    }

    static class UnknownStep extends Step {

        UnknownStep(String id) {
            super(id);
        }
    }

    @Test
    void dispatch_container_throwsStructural() {
        GraphNode container = arena.addContainer(stageNode, "Nested");

        GraphStructureException e = assertThrows(GraphStructureException.class, () -> dispatcher.dispatch(container));
        assertEquals(ErrorType.STRUCTURAL_ERROR, e.getErrorType());
    }

    @Test
    void dispatch_groupLeaf_throwsStructural() {
        GraphNode group = arena.addLeaf(stageNode, "Wave", new NodeData.Group());
        GraphNode stackGroup = arena.addLeaf(stageNode, "Stack", new NodeData.StackGroup());

        GraphStructureException e = assertThrows(GraphStructureException.class, () -> dispatcher.dispatch(group));
        assertEquals("Wave", e.getContext().get("node"));
        assertThrows(GraphStructureException.class, () -> dispatcher.dispatch(stackGroup));
    }

    @Test
    void dispatch_buildStep_usesSynthConstructId() {
        ScriptStep synth = ScriptStep.builder("Synth").commands("npx cdk synth").primaryOutputDirectory("cdk.out").build();
        GraphNode node = arena.addLeaf(stageNode, "Synth", new NodeData.StepNode(synth, true));

        ActionProducer producer = dispatcher.dispatch(node);

        assertInstanceOf(BuildActionFactory.class, producer);
        assertEquals(ActionDispatcher.SYNTH_CONSTRUCT_ID, ((BuildActionFactory) producer).getConstructId());
    }

    @Test
    void dispatch_scriptStep_usesStepId() {
        ScriptStep test = ScriptStep.builder("UnitTests").commands("npm test").build();
        GraphNode node = arena.addLeaf(stageNode, "UnitTests", new NodeData.StepNode(test, false));

        ActionProducer producer = dispatcher.dispatch(node);

        assertEquals("UnitTests", ((BuildActionFactory) producer).getConstructId());
    }

    @Test
    void dispatch_manualApproval() {
        GraphNode node = arena.addLeaf(stageNode, "Approve",
            new NodeData.StepNode(new ManualApprovalStep("Approve", "Check the staging dashboard"), false));

        ActionProducer producer = dispatcher.dispatch(node);
        assertInstanceOf(ManualApprovalProducer.class, producer);

        PipelineStage stage = new PipelineStage("Prod");
        ProduceResult result = producer.produce(produceOptions(stage, new ArtifactMap()));
        assertEquals(1, result.runOrdersConsumed());
        assertFalse(result.hasProject());
        assertEquals(ActionCategory.APPROVAL, stage.getActions().get(0).getCategory());
        assertEquals("Check the staging dashboard", stage.getActions().get(0).getConfiguration().get("CustomData"));
    }

    @Test
    void dispatch_stepImplementingProducer_returnedAsIs() {
        CustomStep step = new CustomStep("Custom");
        GraphNode node = arena.addLeaf(stageNode, "Custom", new NodeData.StepNode(step, false));

        assertSame(step, dispatcher.dispatch(node));
    }

    @Test
    void dispatch_unknownStep_throwsUnsupported() {
        GraphNode node = arena.addLeaf(stageNode, "Mystery", new NodeData.StepNode(new UnknownStep("Mystery"), false));

        UnsupportedStepException e = assertThrows(UnsupportedStepException.class, () -> dispatcher.dispatch(node));
        assertEquals("Mystery", e.getContext().get("step"));
        assertTrue(e.getMessage().contains("UnknownStep(Mystery)"));
    }

    @Test
    void dispatch_stackNodes() {
        GraphNode prepare = arena.addLeaf(stageNode, "Prepare", new NodeData.Prepare(stack()));
        GraphNode deploy = arena.addLeaf(stageNode, "Deploy", new NodeData.Execute(stack(), false));

        assertInstanceOf(CreateChangeSetProducer.class, dispatcher.dispatch(prepare));
        assertInstanceOf(ExecuteChangeSetProducer.class, dispatcher.dispatch(deploy));
    }

    @Test
    void dispatch_selfUpdate() {
        GraphNode node = arena.addLeaf(stageNode, "SelfMutate", new NodeData.SelfUpdate());

        ActionProducer producer = dispatcher.dispatch(node);

        assertEquals(SelfMutationProducerFactory.CONSTRUCT_ID, ((BuildActionFactory) producer).getConstructId());
    }

    @Test
    void projectType_followsNodeType() {
        ScriptStep synth = ScriptStep.builder("Synth").commands("npx cdk synth").build();
        GraphNode synthNode = arena.addLeaf(stageNode, "Synth", new NodeData.StepNode(synth, true));
        GraphNode assets = arena.addLeaf(stageNode, "FileAsset1", new NodeData.PublishAssets(List.of()));
        GraphNode prepare = arena.addLeaf(stageNode, "Prepare", new NodeData.Prepare(stack()));

        assertEquals(BuildProjectType.SYNTH, BuildProjectType.of(synthNode).orElseThrow());
        assertEquals(BuildProjectType.ASSETS, BuildProjectType.of(assets).orElseThrow());
        assertTrue(BuildProjectType.of(prepare).isEmpty());
        assertTrue(BuildProjectType.STEP.credentialUsage().isEmpty());
    }
}
