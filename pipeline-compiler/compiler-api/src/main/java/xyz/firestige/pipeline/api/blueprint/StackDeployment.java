package xyz.firestige.pipeline.api.blueprint;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一个待部署的栈
 *
 * @since 1.0
 */
public class StackDeployment {

    private final String stackArtifactId;
    private final String stackName;
    private final String account;
    private final String region;
    private final String assumeRoleArn;
    private final String executionRoleArn;
    private final Path absoluteTemplatePath;
    private final Map<String, String> tags;

    private StackDeployment(Builder builder) {
        this.stackArtifactId = Objects.requireNonNull(builder.stackArtifactId, "stackArtifactId cannot be null");
        this.stackName = Objects.requireNonNull(builder.stackName, "stackName cannot be null");
        this.account = builder.account;
        this.region = builder.region;
        this.assumeRoleArn = builder.assumeRoleArn;
        this.executionRoleArn = builder.executionRoleArn;
        this.absoluteTemplatePath = Objects.requireNonNull(builder.absoluteTemplatePath, "absoluteTemplatePath cannot be null");
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    }

    public static Builder builder(String stackArtifactId, String stackName) {
        return new Builder(stackArtifactId, stackName);
    }

    /**
     * 模板相对于云装配根目录的路径
     */
    public Path relativeTemplatePath(Path assemblyRoot) {
        return assemblyRoot.toAbsolutePath().normalize().relativize(absoluteTemplatePath.toAbsolutePath().normalize());
    }

    public String getStackArtifactId() {
        return stackArtifactId;
    }

    public String getStackName() {
        return stackName;
    }

    public String getAccount() {
        return account;
    }

    public String getRegion() {
        return region;
    }

    public String getAssumeRoleArn() {
        return assumeRoleArn;
    }

    public String getExecutionRoleArn() {
        return executionRoleArn;
    }

    public Path getAbsoluteTemplatePath() {
        return absoluteTemplatePath;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return "StackDeployment{" + stackArtifactId + '}';
    }

    public static class Builder {
        private final String stackArtifactId;
        private final String stackName;
        private String account;
        private String region;
        private String assumeRoleArn;
        private String executionRoleArn;
        private Path absoluteTemplatePath;
        private final Map<String, String> tags = new LinkedHashMap<>();

        private Builder(String stackArtifactId, String stackName) {
            this.stackArtifactId = stackArtifactId;
            this.stackName = stackName;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder assumeRoleArn(String assumeRoleArn) {
            this.assumeRoleArn = assumeRoleArn;
            return this;
        }

        public Builder executionRoleArn(String executionRoleArn) {
            this.executionRoleArn = executionRoleArn;
            return this;
        }

        public Builder absoluteTemplatePath(Path absoluteTemplatePath) {
            this.absoluteTemplatePath = absoluteTemplatePath;
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public StackDeployment build() {
            return new StackDeployment(this);
        }
    }
}
