package xyz.firestige.pipeline.core.dispatch;

import xyz.firestige.pipeline.api.credential.CredentialUsage;
import xyz.firestige.pipeline.api.graph.GraphNode;
import xyz.firestige.pipeline.api.graph.NodeData;

import java.util.Optional;

/**
 * 构建项目类型
 * <p>
 * 决定节点使用哪一组构建默认配置，以及其项目角色需要哪种仓库凭证。
 */
public enum BuildProjectType {

    SYNTH(CredentialUsage.SYNTH),

    ASSETS(CredentialUsage.ASSET_PUBLISHING),

    SELF_MUTATE(CredentialUsage.SELF_UPDATE),

    STEP(null);

    private final CredentialUsage credentialUsage;

    BuildProjectType(CredentialUsage credentialUsage) {
        this.credentialUsage = credentialUsage;
    }

    public Optional<CredentialUsage> credentialUsage() {
        return Optional.ofNullable(credentialUsage);
    }

    /**
     * 节点对应的项目类型，变更集等不产生构建项目的节点返回 empty
     */
    public static Optional<BuildProjectType> of(GraphNode node) {
        NodeData data = node.data();
        if (data == null) {
            return Optional.empty();
        }
        return switch (data.type()) {
            case STEP -> Optional.of(((NodeData.StepNode) data).isBuildStep() ? SYNTH : STEP);
            case PUBLISH_ASSETS -> Optional.of(ASSETS);
            case SELF_UPDATE -> Optional.of(SELF_MUTATE);
            case GROUP, STACK_GROUP, PREPARE, EXECUTE -> Optional.empty();
        };
    }
}
