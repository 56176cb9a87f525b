package xyz.firestige.pipeline.api.blueprint;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 栈依赖的待发布资产
 *
 * @param assetId               资产 ID
 * @param assetType             资产类型
 * @param assetManifestPath     资产清单文件的绝对路径
 * @param assetSelector         发布命令使用的资产选择器
 * @param assetPublishingRoleArn 发布时需要扮演的角色 ARN（可能含占位符），可为 null
 */
public record StackAsset(String assetId,
                         AssetType assetType,
                         Path assetManifestPath,
                         String assetSelector,
                         String assetPublishingRoleArn) {

    public StackAsset {
        Objects.requireNonNull(assetId, "assetId cannot be null");
        Objects.requireNonNull(assetType, "assetType cannot be null");
        Objects.requireNonNull(assetManifestPath, "assetManifestPath cannot be null");
        Objects.requireNonNull(assetSelector, "assetSelector cannot be null");
    }
}
