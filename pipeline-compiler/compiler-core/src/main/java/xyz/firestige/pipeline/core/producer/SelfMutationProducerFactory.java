package xyz.firestige.pipeline.core.producer;

import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.blueprint.BuildStep;
import xyz.firestige.pipeline.api.blueprint.FileSet;
import xyz.firestige.pipeline.api.model.BuildEnvironment;
import xyz.firestige.pipeline.api.model.PolicyStatement;
import xyz.firestige.pipeline.core.CompilerOptions;
import xyz.firestige.pipeline.core.support.AssemblyContext;

import java.util.List;
import java.util.Objects;

/**
 * 流水线自更新动作
 *
 * <p>在云装配上重新部署流水线所在的栈。项目角色可以扮演带有引导角色标签
 * （image-publishing、file-publishing、deploy）的角色，并能查询栈状态、列举存储桶。
 *
 * @since 1.0
 */
public class SelfMutationProducerFactory {

    public static final String STEP_ID = "SelfMutate";
    public static final String CONSTRUCT_ID = "SelfMutation";
    public static final String SCOPE = "UpdatePipeline";

    static final List<String> BOOTSTRAP_ROLE_TAGS = List.of("image-publishing", "file-publishing", "deploy");

    private final CompilerOptions options;
    private final FileSet cloudAssembly;
    private final AssemblyContext assembly;

    public SelfMutationProducerFactory(CompilerOptions options, FileSet cloudAssembly, AssemblyContext assembly) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.cloudAssembly = Objects.requireNonNull(cloudAssembly, "cloudAssembly cannot be null");
        this.assembly = Objects.requireNonNull(assembly, "assembly cannot be null");
    }

    public ActionProducer create() {
        String account = options.getEnvironment().account();
        BuildStep step = BuildStep.newBuilder(STEP_ID)
            .projectName(options.getPipelineName() != null ? options.getPipelineName() + "-selfupdate" : null)
            .input(cloudAssembly)
            .installCommands("npm install -g aws-cdk" + options.installSuffix())
            .commands("cdk -a " + options.getEmbeddedAssemblyPath().replace('\\', '/') + " deploy "
                + options.getPipelineStackId() + " --require-approval=never --verbose")
            .buildEnvironment(options.isPipelineUsesDockerAssets()
                ? BuildEnvironment.privileged(true)
                : BuildEnvironment.empty())
            .rolePolicyStatement(PolicyStatement.builder()
                .actions("sts:AssumeRole")
                .resources("arn:*:iam::" + account + ":role/*")
                .condition("ForAnyValue:StringEquals", "iam:ResourceTag/aws-cdk:bootstrap-role", BOOTSTRAP_ROLE_TAGS)
                .build())
            .rolePolicyStatement(PolicyStatement.builder()
                .actions("cloudformation:DescribeStacks")
                .resources("*")
                .build())
            .rolePolicyStatement(PolicyStatement.builder()
                .actions("s3:ListBucket")
                .resources("*")
                .build())
            .build();

        return new BuildActionFactory(CONSTRUCT_ID, step,
            new BuildActionFactory.Settings(SCOPE, false, null, false), assembly);
    }
}
