package xyz.firestige.pipeline.core;

import xyz.firestige.pipeline.api.model.Artifact;
import xyz.firestige.pipeline.api.model.BuildProject;
import xyz.firestige.pipeline.core.cache.AssetRoleCache;

import java.util.Objects;

/**
 * 单次编译的共享状态
 * <p>
 * 只在一次 {@code compile} 调用内存在，通过引用在各组件之间传递，不使用任何全局状态。
 */
public class CompilerState {

    private final SelfMutationBarrier barrier;
    private final AssetRoleCache roleCache;
    private Artifact fallbackArtifact;
    private BuildProject synthProject;

    public CompilerState(SelfMutationBarrier barrier, AssetRoleCache roleCache) {
        this.barrier = Objects.requireNonNull(barrier, "barrier cannot be null");
        this.roleCache = Objects.requireNonNull(roleCache, "roleCache cannot be null");
    }

    public SelfMutationBarrier getBarrier() {
        return barrier;
    }

    public AssetRoleCache getRoleCache() {
        return roleCache;
    }

    /**
     * 第一个产出主输出的步骤对应的制品，未指定输入的动作以它为默认输入
     */
    public Artifact getFallbackArtifact() {
        return fallbackArtifact;
    }

    /**
     * 只在尚未设置时生效
     *
     * @return 是否设置成功
     */
    public boolean offerFallbackArtifact(Artifact artifact) {
        if (fallbackArtifact != null || artifact == null) {
            return false;
        }
        fallbackArtifact = artifact;
        return true;
    }

    public BuildProject getSynthProject() {
        return synthProject;
    }

    public void setSynthProject(BuildProject synthProject) {
        this.synthProject = synthProject;
    }
}
