package xyz.firestige.pipeline.core.dispatch;

import xyz.firestige.pipeline.api.model.BuildEnvironment;
import xyz.firestige.pipeline.api.model.BuildOptions;
import xyz.firestige.pipeline.core.CompilerOptions;

import java.util.EnumMap;
import java.util.Map;

/**
 * 各项目类型的构建默认配置
 * <p>
 * 合并顺序：基础默认（STANDARD_5_0 镜像、SMALL 规格） → 全局 buildDefaults → 类型专属默认。
 */
public class BuildDefaults {

    private static final BuildOptions BASE = BuildOptions.builder()
        .buildEnvironment(new BuildEnvironment(BuildEnvironment.STANDARD_5_0, BuildEnvironment.COMPUTE_SMALL, null, null))
        .build();

    private final Map<BuildProjectType, BuildOptions> resolved = new EnumMap<>(BuildProjectType.class);

    public BuildDefaults(CompilerOptions options) {
        for (BuildProjectType type : BuildProjectType.values()) {
            BuildOptions specific = switch (type) {
                case ASSETS -> options.getAssetPublishingBuildDefaults();
                case SELF_MUTATE -> options.getSelfMutationBuildDefaults();
                case SYNTH, STEP -> null;
            };
            resolved.put(type, BuildOptions.merge(BASE, options.getBuildDefaults(), specific));
        }
    }

    public BuildOptions defaultsFor(BuildProjectType type) {
        return resolved.get(type);
    }
}
