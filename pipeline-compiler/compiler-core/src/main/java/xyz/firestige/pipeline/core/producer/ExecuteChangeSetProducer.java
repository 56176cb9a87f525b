package xyz.firestige.pipeline.core.producer;

import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.ProduceOptions;
import xyz.firestige.pipeline.api.ProduceResult;
import xyz.firestige.pipeline.api.blueprint.StackDeployment;
import xyz.firestige.pipeline.api.model.ActionCategory;
import xyz.firestige.pipeline.api.model.PipelineEnvironment;
import xyz.firestige.pipeline.api.model.StageAction;
import xyz.firestige.pipeline.core.support.PlaceholderRoleResolver;

import java.util.Objects;

/**
 * 执行变更集动作
 * <p>
 * 需要记录栈输出时，以栈制品 ID 作为变量命名空间。
 */
public class ExecuteChangeSetProducer implements ActionProducer {

    private final StackDeployment stack;
    private final boolean captureOutputs;
    private final PipelineEnvironment environment;
    private final PlaceholderRoleResolver roles;

    public ExecuteChangeSetProducer(StackDeployment stack, boolean captureOutputs,
                                    PipelineEnvironment environment, PlaceholderRoleResolver roles) {
        this.stack = Objects.requireNonNull(stack, "stack cannot be null");
        this.captureOutputs = captureOutputs;
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.roles = Objects.requireNonNull(roles, "roles cannot be null");
    }

    @Override
    public ProduceResult produce(ProduceOptions options) {
        String region = CreateChangeSetProducer.differentOrNull(stack.getRegion(), environment.region());
        String account = CreateChangeSetProducer.differentOrNull(stack.getAccount(), environment.account());

        options.stage().addAction(StageAction.builder(options.actionName(), ActionCategory.EXECUTE_CHANGE_SET)
            .runOrder(options.runOrder())
            .configuration("ActionMode", "CHANGE_SET_EXECUTE")
            .configuration("ChangeSetName", CreateChangeSetProducer.CHANGE_SET_NAME)
            .configuration("StackName", stack.getStackName())
            .role(roles.resolve(region, account, stack.getAssumeRoleArn()))
            .region(region)
            .variablesNamespace(captureOutputs ? stack.getStackArtifactId() : null)
            .build());
        return ProduceResult.of(1);
    }
}
