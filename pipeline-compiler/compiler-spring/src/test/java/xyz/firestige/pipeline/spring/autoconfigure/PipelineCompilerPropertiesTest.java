package xyz.firestige.pipeline.spring.autoconfigure;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import xyz.firestige.pipeline.core.CompilerOptions;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineCompilerPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(PipelineCompilerAutoConfiguration.class));

    @Test
    void properties_defaults() {
        contextRunner.run(ctx -> {
            PipelineCompilerProperties properties = ctx.getBean(PipelineCompilerProperties.class);
            assertThat(properties.isEnabled()).isTrue();
            assertThat(properties.isSelfMutation()).isTrue();
            assertThat(properties.getStageCapacity()).isEqualTo(50);
            assertThat(properties.getAssemblyRoot()).isEqualTo("cdk.out");
            assertThat(properties.getEnvironment().getPartition()).isEqualTo("aws");
        });
    }

    @Test
    void properties_customValues_loaded() {
        contextRunner
            .withPropertyValues(
                "pipeline.compiler.pipeline-name=orders-pipeline",
                "pipeline.compiler.cli-version=2.100.0",
                "pipeline.compiler.stage-capacity=20",
                "pipeline.compiler.single-publisher-per-asset-type=true",
                "pipeline.compiler.pipeline-stack-id=OrdersPipelineStack",
                "pipeline.compiler.environment.account=111111111111",
                "pipeline.compiler.environment.region=cn-north-1",
                "pipeline.compiler.environment.partition=aws-cn")
            .run(ctx -> {
                CompilerOptions options = ctx.getBean(PipelineCompilerProperties.class).toCompilerOptions().build();
                assertThat(options.getPipelineName()).isEqualTo("orders-pipeline");
                assertThat(options.installSuffix()).isEqualTo("@2.100.0");
                assertThat(options.getStageCapacity()).isEqualTo(20);
                assertThat(options.isSinglePublisherPerAssetType()).isTrue();
                assertThat(options.getPipelineStackId()).isEqualTo("OrdersPipelineStack");
                assertThat(options.getEnvironment().partition()).isEqualTo("aws-cn");
                assertThat(options.getAssemblyRoot()).isEqualTo(Path.of("cdk.out"));
            });
    }

    @Test
    void toCompilerOptions_missingEnvironment_throws() {
        PipelineCompilerProperties properties = new PipelineCompilerProperties();

        assertThatThrownBy(properties::toCompilerOptions).isInstanceOf(NullPointerException.class);
    }
}
