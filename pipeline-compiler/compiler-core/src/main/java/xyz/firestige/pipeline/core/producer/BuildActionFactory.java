package xyz.firestige.pipeline.core.producer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.ProduceOptions;
import xyz.firestige.pipeline.api.ProduceResult;
import xyz.firestige.pipeline.api.blueprint.BuildStep;
import xyz.firestige.pipeline.api.blueprint.ScriptStep;
import xyz.firestige.pipeline.api.model.ActionCategory;
import xyz.firestige.pipeline.api.model.Artifact;
import xyz.firestige.pipeline.api.model.AttachedPolicy;
import xyz.firestige.pipeline.api.model.BuildEnvironment;
import xyz.firestige.pipeline.api.model.BuildOptions;
import xyz.firestige.pipeline.api.model.BuildProject;
import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.PolicyStatement;
import xyz.firestige.pipeline.api.model.StageAction;
import xyz.firestige.pipeline.core.support.AssemblyContext;
import xyz.firestige.pipeline.exception.PipelineValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 脚本步骤到构建动作的适配
 *
 * <p>每次生产创建一个构建项目和一个 BUILD 动作，占用 1 个执行顺序槽位：
 * <ul>
 *   <li>输入：步骤声明的输入，未声明时使用默认制品，两者都没有则校验失败</li>
 *   <li>输出：步骤主产出对应的制品</li>
 *   <li>角色：步骤指定的角色，未指定时为项目单独创建</li>
 *   <li>构建规格：默认配置、步骤局部规格、命令依次深度合并</li>
 * </ul>
 * 动作在自更新之前执行时，项目配置摘要作为环境变量写入动作，项目变化会触发流水线重启。
 *
 * @since 1.0
 */
public class BuildActionFactory implements ActionProducer {

    private static final Logger log = LoggerFactory.getLogger(BuildActionFactory.class);

    public static final String BUILD_SPEC_VERSION = "0.2";
    public static final String CONFIG_HASH_VARIABLE = "_PROJECT_CONFIG_HASH";

    private final String constructId;
    private final ScriptStep step;
    private final Settings settings;
    private final AssemblyContext assembly;

    /**
     * 内置生产者使用的定制项
     *
     * @param scope                    项目所在的逻辑作用域，null 表示使用 Stage 作用域
     * @param additionalConstructLevel 是否在作用域下再包一层以 constructId 命名的节点
     * @param additionalDependable     项目额外依赖的附加策略
     * @param passBuildSpecViaAssembly 构建规格写入云装配目录并按路径引用
     */
    public record Settings(String scope,
                           boolean additionalConstructLevel,
                           AttachedPolicy additionalDependable,
                           boolean passBuildSpecViaAssembly) {

        public static Settings defaults() {
            return new Settings(null, true, null, false);
        }
    }

    public BuildActionFactory(String constructId, ScriptStep step, AssemblyContext assembly) {
        this(constructId, step, Settings.defaults(), assembly);
    }

    public BuildActionFactory(String constructId, ScriptStep step, Settings settings, AssemblyContext assembly) {
        this.constructId = Objects.requireNonNull(constructId, "constructId cannot be null");
        this.step = Objects.requireNonNull(step, "step cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.assembly = Objects.requireNonNull(assembly, "assembly cannot be null");
    }

    @Override
    public ProduceResult produce(ProduceOptions options) {
        BuildOptions defaults = options.buildDefaults();
        BuildStep buildStep = step instanceof BuildStep b ? b : null;

        Artifact input = resolveInput(options);
        Artifact output = step.getPrimaryOutput() != null
            ? options.artifacts().toPipelineArtifact(step.getPrimaryOutput())
            : null;

        BuildEnvironment environment = defaults.getBuildEnvironment()
            .merge(buildStep != null ? buildStep.getBuildEnvironment() : null)
            .merge(new BuildEnvironment(null, null, null, step.getEnv()));

        String scope = settings.scope() != null ? settings.scope() : options.scope();
        String logicalPath = settings.additionalConstructLevel()
            ? scope + "/" + constructId + "/" + constructId
            : scope + "/" + constructId;

        ExecutionRole role = buildStep != null && buildStep.getRole() != null
            ? buildStep.getRole()
            : ExecutionRole.create(constructId + "Role", "codebuild.amazonaws.com");
        grant(role, defaults.getRolePolicy());
        if (buildStep != null) {
            grant(role, buildStep.getRolePolicyStatements());
        }

        Map<String, Object> buildSpec = buildSpec(defaults, buildStep);
        String projectName = buildStep != null ? buildStep.getProjectName() : null;

        BuildProject.Builder project = BuildProject.builder(constructId)
            .logicalPath(logicalPath)
            .projectName(projectName)
            .environment(environment)
            .role(role)
            .vpc(defaults.getVpc())
            .timeout(buildStep != null ? buildStep.getTimeout() : null);

        if (settings.passBuildSpecViaAssembly()) {
            String fileName = "buildspec-" + logicalPath.replaceAll("[^A-Za-z0-9_-]", "-") + ".yaml";
            project.buildSpecPath(assembly.writeJson(fileName, buildSpec));
        } else {
            project.inlineBuildSpec(buildSpec);
        }
        BuildProject built = project.build();
        built.addDependency(settings.additionalDependable());

        StageAction.Builder action = StageAction.builder(options.actionName(), ActionCategory.BUILD)
            .runOrder(options.runOrder())
            .configuration("ProjectName", projectName != null ? projectName : logicalPath)
            .input(input)
            .output(output)
            .role(buildStep != null ? buildStep.getActionRole() : null);

        if (options.beforeSelfMutation()) {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("projectName", projectName);
            config.put("buildImage", environment.getBuildImage());
            config.put("computeType", environment.getComputeType());
            config.put("privileged", environment.isPrivileged());
            config.put("environmentVariables", environment.getEnvironmentVariables());
            config.put("buildSpec", buildSpec);
            action.configuration("EnvironmentVariables", List.of(Map.of(
                "name", CONFIG_HASH_VARIABLE,
                "type", "PLAINTEXT",
                "value", assembly.hash(config))));
        }

        options.stage().addAction(action.build());
        log.debug("Build action {} -> project {} (runOrder={})", options.actionName(), logicalPath, options.runOrder());
        return ProduceResult.of(1, built);
    }

    private Artifact resolveInput(ProduceOptions options) {
        if (step.getInput() != null) {
            return options.artifacts().toPipelineArtifact(step.getInput());
        }
        if (options.fallbackArtifact() != null) {
            return options.fallbackArtifact();
        }
        throw new PipelineValidationException(
            "Step '" + step.getId() + "' has no input and no default artifact is available yet")
            .addContext("step", step.getId());
    }

    private Map<String, Object> buildSpec(BuildOptions defaults, BuildStep buildStep) {
        Map<String, Object> phases = new LinkedHashMap<>();
        if (!step.getInstallCommands().isEmpty()) {
            phases.put("install", Map.of("commands", step.getInstallCommands()));
        }
        phases.put("build", Map.of("commands", step.getCommands()));

        Map<String, Object> own = new LinkedHashMap<>();
        own.put("version", BUILD_SPEC_VERSION);
        own.put("phases", phases);
        if (step.getPrimaryOutputDirectory() != null) {
            own.put("artifacts", Map.of(
                "base-directory", step.getPrimaryOutputDirectory(),
                "files", List.of("**/*")));
        }

        return BuildOptions.merge(
            BuildOptions.builder().partialBuildSpec(defaults.getPartialBuildSpec()).build(),
            buildStep != null ? BuildOptions.builder().partialBuildSpec(buildStep.getPartialBuildSpec()).build() : null,
            BuildOptions.builder().partialBuildSpec(own).build()
        ).getPartialBuildSpec();
    }

    private void grant(ExecutionRole role, List<PolicyStatement> statements) {
        for (PolicyStatement statement : statements) {
            if (!role.addToPolicy(statement)) {
                log.debug("Role {} did not accept statement {}", role, statement.getActions());
            }
        }
    }

    public String getConstructId() {
        return constructId;
    }
}
