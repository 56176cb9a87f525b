package xyz.firestige.pipeline.core;

import xyz.firestige.pipeline.api.blueprint.AssetType;
import xyz.firestige.pipeline.api.model.BuildProject;
import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.Pipeline;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 编译结果
 * <p>
 * 只在整张图遍历、延迟权限定稿都成功后才会创建，不存在部分结果。
 *
 * @since 1.0
 */
public class CompiledPlan {

    private final Pipeline pipeline;
    private final List<PlannedStage> stages;
    private final BuildProject synthProject;
    private final Map<AssetType, ExecutionRole> sharedAssetRoles;

    public CompiledPlan(Pipeline pipeline, List<PlannedStage> stages, BuildProject synthProject,
                        Map<AssetType, ExecutionRole> sharedAssetRoles) {
        this.pipeline = pipeline;
        this.stages = List.copyOf(stages);
        this.synthProject = synthProject;
        this.sharedAssetRoles = Map.copyOf(sharedAssetRoles);
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public List<PlannedStage> getStages() {
        return stages;
    }

    public Optional<PlannedStage> getStage(String name) {
        return stages.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public List<String> getStageNames() {
        return stages.stream().map(PlannedStage::name).toList();
    }

    public Optional<BuildProject> getSynthProject() {
        return Optional.ofNullable(synthProject);
    }

    public Map<AssetType, ExecutionRole> getSharedAssetRoles() {
        return sharedAssetRoles;
    }

    public int getActionCount() {
        return stages.stream().mapToInt(s -> s.actions().size()).sum();
    }
}
