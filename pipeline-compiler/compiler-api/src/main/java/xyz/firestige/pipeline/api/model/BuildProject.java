package xyz.firestige.pipeline.api.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 构建项目（脚本构建动作背后的计算身份）
 *
 * <p>构建规范要么内联（{@link #getInlineBuildSpec()}），要么写入云装配目录后按路径引用
 * （{@link #getBuildSpecPath()}），二者互斥。
 *
 * @since 1.0
 */
public class BuildProject {

    private final String constructId;
    private final String logicalPath;
    private final String projectName;
    private final BuildEnvironment environment;
    private final Map<String, Object> inlineBuildSpec;
    private final String buildSpecPath;
    private final ExecutionRole role;
    private final VpcConfig vpc;
    private final Duration timeout;
    private final List<AttachedPolicy> dependencies = new ArrayList<>();

    private BuildProject(Builder builder) {
        this.constructId = Objects.requireNonNull(builder.constructId, "constructId cannot be null");
        this.logicalPath = builder.logicalPath != null ? builder.logicalPath : builder.constructId;
        this.projectName = builder.projectName;
        this.environment = builder.environment != null ? builder.environment : BuildEnvironment.empty();
        this.inlineBuildSpec = builder.inlineBuildSpec;
        this.buildSpecPath = builder.buildSpecPath;
        this.role = Objects.requireNonNull(builder.role, "role cannot be null");
        this.vpc = builder.vpc;
        this.timeout = builder.timeout;
        if (inlineBuildSpec != null && buildSpecPath != null) {
            throw new IllegalArgumentException("Build spec must be either inline or a path, not both");
        }
    }

    public static Builder builder(String constructId) {
        return new Builder(constructId);
    }

    /**
     * 项目必须在该策略生效后才能创建
     */
    public void addDependency(AttachedPolicy policy) {
        if (policy != null && !dependencies.contains(policy)) {
            dependencies.add(policy);
        }
    }

    public String getConstructId() {
        return constructId;
    }

    public String getLogicalPath() {
        return logicalPath;
    }

    public String getProjectName() {
        return projectName;
    }

    public BuildEnvironment getEnvironment() {
        return environment;
    }

    public Map<String, Object> getInlineBuildSpec() {
        return inlineBuildSpec;
    }

    public String getBuildSpecPath() {
        return buildSpecPath;
    }

    public ExecutionRole getRole() {
        return role;
    }

    public VpcConfig getVpc() {
        return vpc;
    }

    /**
     * 构建超时，null 表示使用服务默认值
     */
    public Duration getTimeout() {
        return timeout;
    }

    public List<AttachedPolicy> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    @Override
    public String toString() {
        return "BuildProject{" + logicalPath + (projectName != null ? ", name=" + projectName : "") + '}';
    }

    public static class Builder {
        private final String constructId;
        private String logicalPath;
        private String projectName;
        private BuildEnvironment environment;
        private Map<String, Object> inlineBuildSpec;
        private String buildSpecPath;
        private ExecutionRole role;
        private VpcConfig vpc;
        private Duration timeout;

        private Builder(String constructId) {
            this.constructId = constructId;
        }

        public Builder logicalPath(String logicalPath) {
            this.logicalPath = logicalPath;
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder environment(BuildEnvironment environment) {
            this.environment = environment;
            return this;
        }

        public Builder inlineBuildSpec(Map<String, Object> buildSpec) {
            this.inlineBuildSpec = buildSpec;
            return this;
        }

        public Builder buildSpecPath(String buildSpecPath) {
            this.buildSpecPath = buildSpecPath;
            return this;
        }

        public Builder role(ExecutionRole role) {
            this.role = role;
            return this;
        }

        public Builder vpc(VpcConfig vpc) {
            this.vpc = vpc;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public BuildProject build() {
            return new BuildProject(this);
        }
    }
}
