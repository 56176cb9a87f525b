package xyz.firestige.pipeline.core;

import xyz.firestige.pipeline.api.credential.RegistryCredential;
import xyz.firestige.pipeline.api.model.BuildOptions;
import xyz.firestige.pipeline.api.model.PipelineEnvironment;
import xyz.firestige.pipeline.core.layout.TrancheChunker;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 编译选项（不可变）
 *
 * @since 1.0
 */
public class CompilerOptions {

    public static final String DEFAULT_PIPELINE_STACK_ID = "PipelineStack";

    /**
     * 流水线名称，null 表示由交付服务生成
     */
    private final String pipelineName;

    /**
     * 流水线是否自更新
     */
    private final boolean selfMutation;

    /**
     * 是否为制品存储创建跨账号密钥
     */
    private final boolean crossAccountKeys;

    /**
     * 自更新与资产发布使用的 CLI 版本，null 表示最新版
     */
    private final String cliVersion;

    /**
     * 流水线自身是否构建容器镜像资产（决定自更新项目是否特权运行）
     */
    private final boolean pipelineUsesDockerAssets;

    /**
     * 每种资产类型只使用一个发布动作
     */
    private final boolean singlePublisherPerAssetType;

    private final int stageCapacity;

    private final BuildOptions buildDefaults;
    private final BuildOptions assetPublishingBuildDefaults;
    private final BuildOptions selfMutationBuildDefaults;

    private final List<RegistryCredential> registryCredentials;

    private final PipelineEnvironment environment;

    /**
     * 云装配输出目录
     */
    private final Path assemblyRoot;

    /**
     * 流水线所在栈的标识，自更新命令部署该栈
     */
    private final String pipelineStackId;

    /**
     * 流水线栈所在装配相对于根目录的路径
     */
    private final String embeddedAssemblyPath;

    /**
     * 制品存储桶名，null 时按流水线名生成
     */
    private final String artifactBucketName;

    private CompilerOptions(Builder builder) {
        this.pipelineName = builder.pipelineName;
        this.selfMutation = builder.selfMutation;
        this.crossAccountKeys = builder.crossAccountKeys;
        this.cliVersion = builder.cliVersion;
        this.pipelineUsesDockerAssets = builder.pipelineUsesDockerAssets;
        this.singlePublisherPerAssetType = builder.singlePublisherPerAssetType;
        if (builder.stageCapacity <= 0) {
            throw new IllegalArgumentException("stageCapacity must be positive");
        }
        this.stageCapacity = builder.stageCapacity;
        this.buildDefaults = builder.buildDefaults;
        this.assetPublishingBuildDefaults = builder.assetPublishingBuildDefaults;
        this.selfMutationBuildDefaults = builder.selfMutationBuildDefaults;
        this.registryCredentials = List.copyOf(builder.registryCredentials);
        this.environment = Objects.requireNonNull(builder.environment, "environment cannot be null");
        this.assemblyRoot = Objects.requireNonNull(builder.assemblyRoot, "assemblyRoot cannot be null");
        this.pipelineStackId = builder.pipelineStackId;
        this.embeddedAssemblyPath = builder.embeddedAssemblyPath;
        this.artifactBucketName = builder.artifactBucketName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public boolean isSelfMutation() {
        return selfMutation;
    }

    public boolean isCrossAccountKeys() {
        return crossAccountKeys;
    }

    public String getCliVersion() {
        return cliVersion;
    }

    public boolean isPipelineUsesDockerAssets() {
        return pipelineUsesDockerAssets;
    }

    public boolean isSinglePublisherPerAssetType() {
        return singlePublisherPerAssetType;
    }

    public int getStageCapacity() {
        return stageCapacity;
    }

    public BuildOptions getBuildDefaults() {
        return buildDefaults;
    }

    public BuildOptions getAssetPublishingBuildDefaults() {
        return assetPublishingBuildDefaults;
    }

    public BuildOptions getSelfMutationBuildDefaults() {
        return selfMutationBuildDefaults;
    }

    public List<RegistryCredential> getRegistryCredentials() {
        return registryCredentials;
    }

    public PipelineEnvironment getEnvironment() {
        return environment;
    }

    public Path getAssemblyRoot() {
        return assemblyRoot;
    }

    public String getPipelineStackId() {
        return pipelineStackId;
    }

    public String getEmbeddedAssemblyPath() {
        return embeddedAssemblyPath;
    }

    public String getArtifactBucketName() {
        if (artifactBucketName != null) {
            return artifactBucketName;
        }
        String base = pipelineName != null ? pipelineName : pipelineStackId;
        return base.toLowerCase().replaceAll("[^a-z0-9.-]", "-") + "-artifacts";
    }

    /**
     * CLI 安装命令的版本后缀
     */
    public String installSuffix() {
        return cliVersion != null ? "@" + cliVersion : "";
    }

    public static class Builder {
        private String pipelineName;
        private boolean selfMutation = true;
        private boolean crossAccountKeys = false;
        private String cliVersion;
        private boolean pipelineUsesDockerAssets = false;
        private boolean singlePublisherPerAssetType = false;
        private int stageCapacity = TrancheChunker.DEFAULT_CAPACITY;
        private BuildOptions buildDefaults;
        private BuildOptions assetPublishingBuildDefaults;
        private BuildOptions selfMutationBuildDefaults;
        private final List<RegistryCredential> registryCredentials = new ArrayList<>();
        private PipelineEnvironment environment;
        private Path assemblyRoot;
        private String pipelineStackId = DEFAULT_PIPELINE_STACK_ID;
        private String embeddedAssemblyPath = ".";
        private String artifactBucketName;

        public Builder pipelineName(String pipelineName) {
            this.pipelineName = pipelineName;
            return this;
        }

        public Builder selfMutation(boolean selfMutation) {
            this.selfMutation = selfMutation;
            return this;
        }

        public Builder crossAccountKeys(boolean crossAccountKeys) {
            this.crossAccountKeys = crossAccountKeys;
            return this;
        }

        public Builder cliVersion(String cliVersion) {
            this.cliVersion = cliVersion;
            return this;
        }

        public Builder pipelineUsesDockerAssets(boolean pipelineUsesDockerAssets) {
            this.pipelineUsesDockerAssets = pipelineUsesDockerAssets;
            return this;
        }

        public Builder singlePublisherPerAssetType(boolean singlePublisherPerAssetType) {
            this.singlePublisherPerAssetType = singlePublisherPerAssetType;
            return this;
        }

        public Builder stageCapacity(int stageCapacity) {
            this.stageCapacity = stageCapacity;
            return this;
        }

        public Builder buildDefaults(BuildOptions buildDefaults) {
            this.buildDefaults = buildDefaults;
            return this;
        }

        public Builder assetPublishingBuildDefaults(BuildOptions assetPublishingBuildDefaults) {
            this.assetPublishingBuildDefaults = assetPublishingBuildDefaults;
            return this;
        }

        public Builder selfMutationBuildDefaults(BuildOptions selfMutationBuildDefaults) {
            this.selfMutationBuildDefaults = selfMutationBuildDefaults;
            return this;
        }

        public Builder registryCredential(RegistryCredential credential) {
            this.registryCredentials.add(Objects.requireNonNull(credential, "credential cannot be null"));
            return this;
        }

        public Builder registryCredentials(List<RegistryCredential> credentials) {
            credentials.forEach(this::registryCredential);
            return this;
        }

        public Builder environment(PipelineEnvironment environment) {
            this.environment = environment;
            return this;
        }

        public Builder assemblyRoot(Path assemblyRoot) {
            this.assemblyRoot = assemblyRoot;
            return this;
        }

        public Builder pipelineStackId(String pipelineStackId) {
            this.pipelineStackId = Objects.requireNonNull(pipelineStackId, "pipelineStackId cannot be null");
            return this;
        }

        public Builder embeddedAssemblyPath(String embeddedAssemblyPath) {
            this.embeddedAssemblyPath = Objects.requireNonNull(embeddedAssemblyPath, "embeddedAssemblyPath cannot be null");
            return this;
        }

        public Builder artifactBucketName(String artifactBucketName) {
            this.artifactBucketName = artifactBucketName;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
