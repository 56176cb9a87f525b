package xyz.firestige.pipeline.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;
import xyz.firestige.pipeline.api.model.PipelineEnvironment;
import xyz.firestige.pipeline.core.CompilerOptions;
import xyz.firestige.pipeline.core.layout.TrancheChunker;

import java.nio.file.Path;

/**
 * 流水线编译器配置属性
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "pipeline.compiler")
public class PipelineCompilerProperties {

    /**
     * 是否启用流水线编译器
     */
    private boolean enabled = true;

    /**
     * 流水线名称，为空时由交付服务生成
     */
    private String pipelineName;

    /**
     * 流水线是否自更新
     */
    private boolean selfMutation = true;

    /**
     * 是否为制品存储创建跨账号密钥
     */
    private boolean crossAccountKeys = false;

    /**
     * 自更新与资产发布使用的 CLI 版本
     */
    private String cliVersion;

    private boolean pipelineUsesDockerAssets = false;

    private boolean singlePublisherPerAssetType = false;

    /**
     * 单个 Stage 的动作数量上限
     */
    private int stageCapacity = TrancheChunker.DEFAULT_CAPACITY;

    /**
     * 云装配输出目录
     */
    private String assemblyRoot = "cdk.out";

    private String pipelineStackId = CompilerOptions.DEFAULT_PIPELINE_STACK_ID;

    private String embeddedAssemblyPath = ".";

    private String artifactBucketName;

    /**
     * 流水线所在环境
     */
    private EnvironmentConfig environment = new EnvironmentConfig();

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public void setPipelineName(String pipelineName) {
        this.pipelineName = pipelineName;
    }

    public boolean isSelfMutation() {
        return selfMutation;
    }

    public void setSelfMutation(boolean selfMutation) {
        this.selfMutation = selfMutation;
    }

    public boolean isCrossAccountKeys() {
        return crossAccountKeys;
    }

    public void setCrossAccountKeys(boolean crossAccountKeys) {
        this.crossAccountKeys = crossAccountKeys;
    }

    public String getCliVersion() {
        return cliVersion;
    }

    public void setCliVersion(String cliVersion) {
        this.cliVersion = cliVersion;
    }

    public boolean isPipelineUsesDockerAssets() {
        return pipelineUsesDockerAssets;
    }

    public void setPipelineUsesDockerAssets(boolean pipelineUsesDockerAssets) {
        this.pipelineUsesDockerAssets = pipelineUsesDockerAssets;
    }

    public boolean isSinglePublisherPerAssetType() {
        return singlePublisherPerAssetType;
    }

    public void setSinglePublisherPerAssetType(boolean singlePublisherPerAssetType) {
        this.singlePublisherPerAssetType = singlePublisherPerAssetType;
    }

    public int getStageCapacity() {
        return stageCapacity;
    }

    public void setStageCapacity(int stageCapacity) {
        this.stageCapacity = stageCapacity;
    }

    public String getAssemblyRoot() {
        return assemblyRoot;
    }

    public void setAssemblyRoot(String assemblyRoot) {
        this.assemblyRoot = assemblyRoot;
    }

    public String getPipelineStackId() {
        return pipelineStackId;
    }

    public void setPipelineStackId(String pipelineStackId) {
        this.pipelineStackId = pipelineStackId;
    }

    public String getEmbeddedAssemblyPath() {
        return embeddedAssemblyPath;
    }

    public void setEmbeddedAssemblyPath(String embeddedAssemblyPath) {
        this.embeddedAssemblyPath = embeddedAssemblyPath;
    }

    public String getArtifactBucketName() {
        return artifactBucketName;
    }

    public void setArtifactBucketName(String artifactBucketName) {
        this.artifactBucketName = artifactBucketName;
    }

    public EnvironmentConfig getEnvironment() {
        return environment;
    }

    public void setEnvironment(EnvironmentConfig environment) {
        this.environment = environment;
    }

    /**
     * 转换为编译选项，仓库凭证与构建默认配置由调用方追加
     *
     * @throws NullPointerException 未配置账号或区域
     */
    public CompilerOptions.Builder toCompilerOptions() {
        return CompilerOptions.builder()
            .pipelineName(pipelineName)
            .selfMutation(selfMutation)
            .crossAccountKeys(crossAccountKeys)
            .cliVersion(cliVersion)
            .pipelineUsesDockerAssets(pipelineUsesDockerAssets)
            .singlePublisherPerAssetType(singlePublisherPerAssetType)
            .stageCapacity(stageCapacity)
            .environment(new PipelineEnvironment(environment.getAccount(), environment.getRegion(),
                environment.getPartition()))
            .assemblyRoot(Path.of(assemblyRoot))
            .pipelineStackId(pipelineStackId)
            .embeddedAssemblyPath(embeddedAssemblyPath)
            .artifactBucketName(artifactBucketName);
    }

    /**
     * 流水线所在环境配置
     */
    public static class EnvironmentConfig {
        /**
         * 账号 ID
         */
        private String account;

        /**
         * 区域
         */
        private String region;

        /**
         * 分区
         */
        private String partition = PipelineEnvironment.DEFAULT_PARTITION;

        // Getters and Setters

        public String getAccount() {
            return account;
        }

        public void setAccount(String account) {
            this.account = account;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getPartition() {
            return partition;
        }

        public void setPartition(String partition) {
            this.partition = partition;
        }
    }
}
