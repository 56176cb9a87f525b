package xyz.firestige.pipeline.core.producer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.ProduceOptions;
import xyz.firestige.pipeline.api.ProduceResult;
import xyz.firestige.pipeline.api.blueprint.StackDeployment;
import xyz.firestige.pipeline.api.model.ActionCategory;
import xyz.firestige.pipeline.api.model.Artifact;
import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.PipelineEnvironment;
import xyz.firestige.pipeline.api.model.StageAction;
import xyz.firestige.pipeline.core.support.AssemblyContext;
import xyz.firestige.pipeline.core.support.PlaceholderRoleResolver;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * 创建变更集动作
 *
 * <p>模板从云装配制品中按相对路径引用；栈带标签时在模板旁写出
 * {@code <template>.config.json}（{@code {"Tags": {...}}}）作为模板配置。
 * 区域、账号只有与流水线所在环境不同才写入动作。
 *
 * @since 1.0
 */
public class CreateChangeSetProducer implements ActionProducer {

    private static final Logger log = LoggerFactory.getLogger(CreateChangeSetProducer.class);

    public static final String CHANGE_SET_NAME = "PipelineChange";

    private final StackDeployment stack;
    private final Artifact templateArtifact;
    private final AssemblyContext assembly;
    private final PipelineEnvironment environment;
    private final PlaceholderRoleResolver roles;
    private final String templateConfigurationPath;

    /**
     * 构造时即写出模板配置文件
     */
    public CreateChangeSetProducer(StackDeployment stack,
                                   Artifact templateArtifact,
                                   AssemblyContext assembly,
                                   PipelineEnvironment environment,
                                   PlaceholderRoleResolver roles) {
        this.stack = Objects.requireNonNull(stack, "stack cannot be null");
        this.templateArtifact = Objects.requireNonNull(templateArtifact, "templateArtifact cannot be null");
        this.assembly = Objects.requireNonNull(assembly, "assembly cannot be null");
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.roles = Objects.requireNonNull(roles, "roles cannot be null");
        this.templateConfigurationPath = writeTemplateConfiguration();
    }

    @Override
    public ProduceResult produce(ProduceOptions options) {
        String region = differentOrNull(stack.getRegion(), environment.region());
        String account = differentOrNull(stack.getAccount(), environment.account());

        ExecutionRole actionRole = roles.resolve(region, account, stack.getAssumeRoleArn());
        ExecutionRole deploymentRole = roles.resolve(region, account, stack.getExecutionRoleArn());

        options.stage().addAction(StageAction.builder(options.actionName(), ActionCategory.CREATE_CHANGE_SET)
            .runOrder(options.runOrder())
            .configuration("ActionMode", "CHANGE_SET_REPLACE")
            .configuration("ChangeSetName", CHANGE_SET_NAME)
            .configuration("StackName", stack.getStackName())
            .configuration("TemplatePath", templateArtifact.atPath(assembly.relativize(stack.getAbsoluteTemplatePath())).location())
            .configuration("Capabilities", "CAPABILITY_NAMED_IAM,CAPABILITY_AUTO_EXPAND")
            .configuration("AdminPermissions", Boolean.TRUE)
            .configuration("RoleArn", deploymentRole != null ? deploymentRole.getArn() : null)
            .configuration("TemplateConfiguration", templateConfigurationPath != null
                ? templateArtifact.atPath(templateConfigurationPath).location()
                : null)
            .input(templateArtifact)
            .role(actionRole)
            .region(region)
            .build());
        return ProduceResult.of(1);
    }

    private String writeTemplateConfiguration() {
        if (stack.getTags().isEmpty()) {
            return null;
        }
        Path configFile = Path.of(stack.getAbsoluteTemplatePath() + ".config.json");
        assembly.writeJson(configFile, Map.of("Tags", stack.getTags()));
        log.debug("Wrote template configuration for stack {}", stack.getStackArtifactId());
        return assembly.relativize(configFile);
    }

    static String differentOrNull(String value, String pipelineValue) {
        return value != null && !value.equals(pipelineValue) ? value : null;
    }

    public String getTemplateConfigurationPath() {
        return templateConfigurationPath;
    }
}
