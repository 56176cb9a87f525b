package xyz.firestige.pipeline.api.credential;

/**
 * 镜像仓库凭证的使用场景
 */
public enum CredentialUsage {

    /**
     * 合成（synth）构建
     */
    SYNTH,

    /**
     * 流水线自更新
     */
    SELF_UPDATE,

    /**
     * 资产发布
     */
    ASSET_PUBLISHING
}
