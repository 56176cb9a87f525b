package xyz.firestige.pipeline.api.blueprint;

import xyz.firestige.pipeline.api.model.BuildEnvironment;
import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.PolicyStatement;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 可定制构建项目的脚本步骤
 * <p>
 * 在 {@link ScriptStep} 基础上允许指定项目名、构建环境、执行角色与附加权限。
 *
 * @since 1.0
 */
public class BuildStep extends ScriptStep {

    private final String projectName;
    private final BuildEnvironment buildEnvironment;
    private final ExecutionRole role;
    private final ExecutionRole actionRole;
    private final List<PolicyStatement> rolePolicyStatements;
    private final Map<String, Object> partialBuildSpec;
    private final Duration timeout;

    private BuildStep(Builder builder) {
        super(builder);
        this.projectName = builder.projectName;
        this.buildEnvironment = builder.buildEnvironment;
        this.role = builder.role;
        this.actionRole = builder.actionRole;
        this.rolePolicyStatements = List.copyOf(builder.rolePolicyStatements);
        this.partialBuildSpec = builder.partialBuildSpec == null ? Map.of() : Map.copyOf(builder.partialBuildSpec);
        this.timeout = builder.timeout;
    }

    public static Builder newBuilder(String id) {
        return new Builder(id);
    }

    public String getProjectName() {
        return projectName;
    }

    public BuildEnvironment getBuildEnvironment() {
        return buildEnvironment;
    }

    public ExecutionRole getRole() {
        return role;
    }

    /**
     * 流水线动作本身使用的角色，为 null 时由流水线决定
     */
    public ExecutionRole getActionRole() {
        return actionRole;
    }

    public List<PolicyStatement> getRolePolicyStatements() {
        return rolePolicyStatements;
    }

    public Map<String, Object> getPartialBuildSpec() {
        return partialBuildSpec;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public static final class Builder extends ScriptStep.BaseBuilder<Builder> {
        private String projectName;
        private BuildEnvironment buildEnvironment;
        private ExecutionRole role;
        private ExecutionRole actionRole;
        private final List<PolicyStatement> rolePolicyStatements = new ArrayList<>();
        private Map<String, Object> partialBuildSpec;
        private Duration timeout;

        private Builder(String id) {
            super(id);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder buildEnvironment(BuildEnvironment buildEnvironment) {
            this.buildEnvironment = buildEnvironment;
            return this;
        }

        public Builder role(ExecutionRole role) {
            this.role = role;
            return this;
        }

        public Builder actionRole(ExecutionRole actionRole) {
            this.actionRole = actionRole;
            return this;
        }

        public Builder rolePolicyStatement(PolicyStatement statement) {
            this.rolePolicyStatements.add(statement);
            return this;
        }

        public Builder rolePolicyStatements(List<PolicyStatement> statements) {
            this.rolePolicyStatements.addAll(statements);
            return this;
        }

        public Builder partialBuildSpec(Map<String, Object> partialBuildSpec) {
            this.partialBuildSpec = partialBuildSpec;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public BuildStep build() {
            return new BuildStep(this);
        }
    }
}
