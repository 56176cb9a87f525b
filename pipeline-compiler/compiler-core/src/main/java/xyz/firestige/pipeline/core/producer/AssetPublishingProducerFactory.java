package xyz.firestige.pipeline.core.producer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.blueprint.AssetType;
import xyz.firestige.pipeline.api.blueprint.BuildStep;
import xyz.firestige.pipeline.api.blueprint.FileSet;
import xyz.firestige.pipeline.api.blueprint.StackAsset;
import xyz.firestige.pipeline.api.model.BuildEnvironment;
import xyz.firestige.pipeline.core.CompilerOptions;
import xyz.firestige.pipeline.core.cache.AssetRoleCache;
import xyz.firestige.pipeline.core.cache.SharedAssetRole;
import xyz.firestige.pipeline.core.support.AssemblyContext;
import xyz.firestige.pipeline.exception.PipelineValidationException;

import java.util.List;
import java.util.Objects;

/**
 * 资产发布动作
 *
 * <p>一组资产必须属于同一类型。创建时先把各资产的发布角色登记到共享角色缓存，
 * 再取得（或首次创建）该类型的共享角色；每个资产对应一条发布命令。
 *
 * @since 1.0
 */
public class AssetPublishingProducerFactory {

    private static final Logger log = LoggerFactory.getLogger(AssetPublishingProducerFactory.class);

    public static final String SCOPE = "Assets";

    private final CompilerOptions options;
    private final FileSet cloudAssembly;
    private final AssemblyContext assembly;
    private final AssetRoleCache roleCache;

    public AssetPublishingProducerFactory(CompilerOptions options, FileSet cloudAssembly,
                                          AssemblyContext assembly, AssetRoleCache roleCache) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.cloudAssembly = Objects.requireNonNull(cloudAssembly, "cloudAssembly cannot be null");
        this.assembly = Objects.requireNonNull(assembly, "assembly cannot be null");
        this.roleCache = Objects.requireNonNull(roleCache, "roleCache cannot be null");
    }

    /**
     * @param nodeId 图节点 ID，同时作为构建项目的逻辑 ID
     * @param assets 待发布资产
     * @throws PipelineValidationException 资产为空或类型不一致
     */
    public ActionProducer create(String nodeId, List<StackAsset> assets) {
        if (assets == null || assets.isEmpty()) {
            throw new PipelineValidationException("Publishing step '" + nodeId + "' has no assets")
                .addContext("node", nodeId);
        }
        AssetType assetType = assets.get(0).assetType();
        if (assets.stream().anyMatch(a -> a.assetType() != assetType)) {
            throw new PipelineValidationException("All assets in a single publishing step must be of the same type")
                .addContext("node", nodeId)
                .addContext("category", assetType);
        }

        for (StackAsset asset : assets) {
            if (asset.assetPublishingRoleArn() == null) {
                log.warn("Asset {} in {} has no publishing role, it will be published with the shared {} role only",
                    asset.assetId(), nodeId, assetType);
            }
        }
        roleCache.registerPublishingRoles(assetType,
            assets.stream().map(StackAsset::assetPublishingRoleArn).filter(Objects::nonNull).toList());

        SharedAssetRole shared = roleCache.obtain(assetType);

        List<String> commands = assets.stream()
            .map(a -> "cdk-assets --path \"" + assembly.relativize(a.assetManifestPath())
                + "\" --verbose publish \"" + a.assetSelector() + "\"")
            .toList();

        BuildStep step = BuildStep.newBuilder(nodeId)
            .commands(commands)
            .installCommands("npm install -g cdk-assets" + options.installSuffix())
            .input(cloudAssembly)
            .buildEnvironment(BuildEnvironment.privileged(
                assets.stream().anyMatch(a -> a.assetType() == AssetType.DOCKER_IMAGE)))
            .role(shared.role())
            .build();

        return new BuildActionFactory(nodeId, step,
            new BuildActionFactory.Settings(SCOPE, false, shared.dependable(), options.isSinglePublisherPerAssetType()),
            assembly);
    }
}
