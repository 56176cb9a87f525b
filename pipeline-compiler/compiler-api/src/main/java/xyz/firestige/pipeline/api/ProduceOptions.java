package xyz.firestige.pipeline.api;

import xyz.firestige.pipeline.api.model.Artifact;
import xyz.firestige.pipeline.api.model.BuildOptions;
import xyz.firestige.pipeline.api.model.Pipeline;
import xyz.firestige.pipeline.api.model.PipelineStage;

import java.util.Objects;

/**
 * 动作生产上下文
 *
 * @param pipeline           目标流水线
 * @param stage              动作所在阶段
 * @param scope              阶段的逻辑路径，用于拼接构建项目的逻辑 ID
 * @param actionName         分配的动作名
 * @param runOrder           分配的执行顺序（从 1 开始）
 * @param artifacts          文件集到制品的映射
 * @param fallbackArtifact   未指定输入时可用的默认制品，可为 null
 * @param buildDefaults      该节点项目类型对应的构建默认配置
 * @param beforeSelfMutation 该动作是否在流水线自更新之前执行
 * @param sharedRoles        共享角色只读视图
 */
public record ProduceOptions(Pipeline pipeline,
                             PipelineStage stage,
                             String scope,
                             String actionName,
                             int runOrder,
                             ArtifactResolver artifacts,
                             Artifact fallbackArtifact,
                             BuildOptions buildDefaults,
                             boolean beforeSelfMutation,
                             SharedRoleView sharedRoles) {

    public ProduceOptions {
        Objects.requireNonNull(pipeline, "pipeline cannot be null");
        Objects.requireNonNull(stage, "stage cannot be null");
        Objects.requireNonNull(actionName, "actionName cannot be null");
        Objects.requireNonNull(artifacts, "artifacts cannot be null");
        if (runOrder < 1) {
            throw new IllegalArgumentException("runOrder must be >= 1, got " + runOrder);
        }
        if (buildDefaults == null) {
            buildDefaults = BuildOptions.empty();
        }
    }
}
