package xyz.firestige.pipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.CompileMetricsRecorder;
import xyz.firestige.pipeline.api.CompileSummary;
import xyz.firestige.pipeline.api.ProduceOptions;
import xyz.firestige.pipeline.api.ProduceResult;
import xyz.firestige.pipeline.api.blueprint.FileSet;
import xyz.firestige.pipeline.api.credential.RegistryCredential;
import xyz.firestige.pipeline.api.graph.GraphArena;
import xyz.firestige.pipeline.api.graph.GraphContainer;
import xyz.firestige.pipeline.api.graph.GraphNode;
import xyz.firestige.pipeline.api.graph.LayeredGraph;
import xyz.firestige.pipeline.api.graph.NodeData;
import xyz.firestige.pipeline.api.graph.NodeType;
import xyz.firestige.pipeline.api.model.ArtifactStore;
import xyz.firestige.pipeline.api.model.BuildProject;
import xyz.firestige.pipeline.api.model.Pipeline;
import xyz.firestige.pipeline.api.model.PipelineStage;
import xyz.firestige.pipeline.core.cache.AssetRoleCache;
import xyz.firestige.pipeline.core.dispatch.ActionDispatcher;
import xyz.firestige.pipeline.core.dispatch.BuildDefaults;
import xyz.firestige.pipeline.core.dispatch.BuildProjectType;
import xyz.firestige.pipeline.core.layout.RunOrderAllocator;
import xyz.firestige.pipeline.core.layout.TrancheChunker;
import xyz.firestige.pipeline.core.producer.AssetPublishingProducerFactory;
import xyz.firestige.pipeline.core.producer.SelfMutationProducerFactory;
import xyz.firestige.pipeline.core.support.ActionNames;
import xyz.firestige.pipeline.core.support.ArtifactMap;
import xyz.firestige.pipeline.core.support.AssemblyContext;
import xyz.firestige.pipeline.core.support.PlaceholderRoleResolver;
import xyz.firestige.pipeline.exception.AlreadyBuiltException;
import xyz.firestige.pipeline.exception.GraphStructureException;
import xyz.firestige.pipeline.exception.NotBuiltException;
import xyz.firestige.pipeline.exception.PipelineCompileException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 流水线编译器
 *
 * <p>把分层后的依赖图编译为 Stage / 动作计划：
 * <ol>
 *   <li>每个顶层容器按容量切分为一个或多个 Stage，溢出时命名为 {@code <容器ID>.<n>}</li>
 *   <li>Stage 内按 tranche 顺序分配执行顺序，同一 tranche 的节点并发</li>
 *   <li>每个叶子节点经 {@link ActionDispatcher} 选择生产者并生产动作</li>
 *   <li>后处理：仓库凭证授权、合成项目记录、默认制品记录</li>
 *   <li>遍历结束后固化所有延迟权限，关闭共享角色视图</li>
 * </ol>
 *
 * <p>单线程、单次使用：同一实例只能 {@link #compile(LayeredGraph)} 一次。
 *
 * @since 1.0
 */
public class PipelineCompiler {

    private static final Logger log = LoggerFactory.getLogger(PipelineCompiler.class);

    private final CompilerOptions options;
    private final AssemblyContext assembly;
    private final CompileMetricsRecorder metricsRecorder;
    private final TrancheChunker chunker;
    private final BuildDefaults buildDefaults;

    private boolean compiled = false;
    private Pipeline pipeline;
    private BuildProject synthProject;

    public PipelineCompiler(CompilerOptions options, AssemblyContext assembly, CompileMetricsRecorder metricsRecorder) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.assembly = Objects.requireNonNull(assembly, "assembly cannot be null");
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : CompileMetricsRecorder.noop();
        this.chunker = new TrancheChunker(options.getStageCapacity());
        this.buildDefaults = new BuildDefaults(options);
    }

    /**
     * 编译分层图
     *
     * @throws AlreadyBuiltException       重复调用
     * @throws GraphStructureException     顶层元素不是容器，或容器出现在叶子位置
     * @throws PipelineCompileException    其他校验失败，上下文中带有 Stage 与节点信息
     */
    public CompiledPlan compile(LayeredGraph graph) {
        Objects.requireNonNull(graph, "graph cannot be null");
        if (compiled) {
            throw new AlreadyBuiltException("Pipeline already created");
        }
        compiled = true;

        long start = System.nanoTime();
        String pipelineName = options.getPipelineName();
        log.info("Compiling pipeline {}: {} top-level container(s), selfMutation={}",
            pipelineName, graph.containers().size(), options.isSelfMutation());
        try {
            CompiledPlan plan = doCompile(graph);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Compiled pipeline {}: {} stage(s), {} action(s), {} shared role(s) in {} ms",
                pipelineName, plan.getStages().size(), plan.getActionCount(),
                plan.getSharedAssetRoles().size(), elapsed.toMillis());
            metricsRecorder.record(new CompileSummary(pipelineName, plan.getStages().size(),
                plan.getActionCount(), plan.getSharedAssetRoles().size(), elapsed, true));
            return plan;
        } catch (RuntimeException e) {
            log.error("Failed to compile pipeline {}: {}", pipelineName, e.getMessage());
            metricsRecorder.record(CompileSummary.failed(pipelineName, Duration.ofNanos(System.nanoTime() - start)));
            throw e;
        }
    }

    private CompiledPlan doCompile(LayeredGraph graph) {
        ArtifactStore store = new ArtifactStore(options.getArtifactBucketName(), options.getEnvironment());
        Pipeline target = new Pipeline(options.getPipelineName(), options.isCrossAccountKeys(), true, store);

        ArtifactMap artifacts = new ArtifactMap();
        PlaceholderRoleResolver roles = new PlaceholderRoleResolver(options.getEnvironment());
        AssetRoleCache roleCache = new AssetRoleCache(options.getEnvironment(), store,
            options.getRegistryCredentials(),
            () -> buildDefaults.defaultsFor(BuildProjectType.ASSETS).getVpc(),
            roles);
        CompilerState state = new CompilerState(new SelfMutationBarrier(options.isSelfMutation()), roleCache);

        FileSet cloudAssembly = graph.cloudAssemblyFileSet();
        ActionDispatcher dispatcher = new ActionDispatcher(
            new SelfMutationProducerFactory(options, cloudAssembly, assembly),
            new AssetPublishingProducerFactory(options, cloudAssembly, assembly, roleCache),
            assembly, roles, options.getEnvironment(),
            () -> artifacts.toPipelineArtifact(cloudAssembly));

        List<PlannedStage> stages = new ArrayList<>();
        List<BuildProject> projects = new ArrayList<>();
        for (GraphContainer container : graph.containers()) {
            if (!container.node().isContainer()) {
                throw new GraphStructureException("Top-level children must be graphs, got '" + container.id() + "'")
                    .addContext("node", container.id());
            }
            List<List<List<GraphNode>>> chunks = chunker.chunk(container.sortedLeaves());
            boolean overflow = chunks.size() > 1;
            for (int i = 0; i < chunks.size(); i++) {
                String stageName = overflow ? container.id() + "." + (i + 1) : container.id();
                try {
                    PipelineStage stage = target.addStage(stageName);
                    List<PlannedAction> actions = compileStage(graph.arena(), target, stage, chunks.get(i),
                        state, dispatcher, artifacts, projects);
                    stages.add(new PlannedStage(stageName, container.id(), actions));
                    log.debug("Stage {}: {} action(s)", stageName, actions.size());
                } catch (PipelineCompileException e) {
                    e.addContext("stage", stageName);
                    throw e;
                }
            }
        }

        roleCache.finalizeRoles();
        projects.forEach(p -> p.getRole().finalizeStatements());
        CompiledPlan plan = new CompiledPlan(target, stages, state.getSynthProject(), roleCache.snapshot());
        roleCache.close();
        this.pipeline = target;
        this.synthProject = state.getSynthProject();
        return plan;
    }

    private List<PlannedAction> compileStage(GraphArena arena,
                                             Pipeline target,
                                             PipelineStage stage,
                                             List<List<GraphNode>> tranches,
                                             CompilerState state,
                                             ActionDispatcher dispatcher,
                                             ArtifactMap artifacts,
                                             List<BuildProject> projects) {
        List<GraphNode> all = tranches.stream().flatMap(List::stream).toList();
        GraphNode sharedParent = arena.commonAncestor(all);
        String scope = "Pipeline/" + stage.getName();

        RunOrderAllocator allocator = new RunOrderAllocator();
        List<PlannedAction> planned = new ArrayList<>();
        for (List<GraphNode> tranche : tranches) {
            int runOrder = allocator.current();
            for (GraphNode node : tranche) {
                BuildProjectType projectType = BuildProjectType.of(node).orElse(null);
                String actionName = ActionNames.of(arena, node, sharedParent);
                ProduceResult result;
                try {
                    ActionProducer producer = dispatcher.dispatch(node);
                    result = producer.produce(new ProduceOptions(
                        target,
                        stage,
                        scope,
                        actionName,
                        runOrder,
                        artifacts,
                        state.getFallbackArtifact(),
                        projectType != null ? buildDefaults.defaultsFor(projectType) : null,
                        state.getBarrier().isBeforeSelfMutation(),
                        state.getRoleCache()));
                } catch (PipelineCompileException e) {
                    e.addContext("node", node.id());
                    throw e;
                }

                if (node.data().type() == NodeType.SELF_UPDATE) {
                    state.getBarrier().clear();
                }
                postProcess(node, projectType, result, state, artifacts);
                if (result.hasProject()) {
                    projects.add(result.project());
                }

                allocator.record(result.runOrdersConsumed());
                planned.add(new PlannedAction(actionName, runOrder, node.id(), node.data().type(),
                    result.runOrdersConsumed(), result.project()));
                log.debug("Scheduled {} in {} at runOrder {} (consumed {})",
                    actionName, stage.getName(), runOrder, result.runOrdersConsumed());
            }
            allocator.advance();
        }
        return planned;
    }

    private void postProcess(GraphNode node, BuildProjectType projectType, ProduceResult result,
                             CompilerState state, ArtifactMap artifacts) {
        if (result.hasProject()) {
            BuildProjectType type = projectType != null ? projectType : BuildProjectType.STEP;
            type.credentialUsage().ifPresent(usage -> {
                for (RegistryCredential credential : options.getRegistryCredentials()) {
                    credential.grantRead(result.project().getRole(), usage);
                }
            });
            if (type == BuildProjectType.SYNTH) {
                state.setSynthProject(result.project());
            }
        }

        if (node.data() instanceof NodeData.StepNode stepNode && stepNode.step().getPrimaryOutput() != null
            && state.getFallbackArtifact() == null) {
            state.offerFallbackArtifact(artifacts.toPipelineArtifact(stepNode.step().getPrimaryOutput()));
            log.debug("Default artifact set from step {}", stepNode.step().getId());
        }
    }

    /**
     * 合成步骤的构建项目
     *
     * @throws NotBuiltException 尚未编译，或图中没有合成步骤
     */
    public BuildProject synthProject() {
        if (synthProject == null) {
            throw new NotBuiltException("Call compile() before reading the synth project");
        }
        return synthProject;
    }

    /**
     * 编译出的流水线
     *
     * @throws NotBuiltException 尚未编译
     */
    public Pipeline pipeline() {
        if (pipeline == null) {
            throw new NotBuiltException("Pipeline not created yet");
        }
        return pipeline;
    }

    public boolean isCompiled() {
        return compiled;
    }
}
