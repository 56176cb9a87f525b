package xyz.firestige.pipeline.api.blueprint;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptStepTest {

    @Test
    void primaryOutputDirectory_createsProducedFileSet() {
        ScriptStep synth = ScriptStep.builder("Synth")
            .commands("npm ci", "npx cdk synth")
            .primaryOutputDirectory("cdk.out")
            .build();

        assertThat(synth.getPrimaryOutput()).isNotNull();
        assertThat(synth.getPrimaryOutput().getProducer()).isSameAs(synth);
    }

    @Test
    void input_registeredAsDependency() {
        FileSet source = new FileSet("Source");
        ScriptStep test = ScriptStep.builder("Test").commands("make test").input(source).build();

        assertThat(test.getDependencyFileSets()).containsExactly(source);
        assertThat(test.getPrimaryOutput()).isNull();
    }

    @Test
    void noCommands_rejected() {
        assertThatThrownBy(() -> ScriptStep.builder("Empty").build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fileSet_producerSetOnce() {
        FileSet fileSet = new FileSet("Out");
        ManualApprovalStep first = new ManualApprovalStep("First");
        ManualApprovalStep second = new ManualApprovalStep("Second");
        fileSet.producedBy(first);

        assertThatThrownBy(() -> fileSet.producedBy(second)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void buildStep_keepsScriptAndBuildSettings() {
        BuildStep step = BuildStep.newBuilder("Integ")
            .commands("./run.sh")
            .env("STAGE", "beta")
            .projectName("integ-tests")
            .build();

        assertThat(step.getCommands()).containsExactly("./run.sh");
        assertThat(step.getEnv()).containsEntry("STAGE", "beta");
        assertThat(step.getProjectName()).isEqualTo("integ-tests");
        assertThat(step.getRolePolicyStatements()).isEmpty();
    }

    @Test
    void buildStep_factoryDistinctFromScriptStepFactory() {
        ScriptStep script = ScriptStep.builder("Lint").commands("npm run lint").build();
        BuildStep build = BuildStep.newBuilder("Lint").commands("npm run lint").primaryOutputDirectory("reports").build();

        assertThat(script).isExactlyInstanceOf(ScriptStep.class);
        assertThat(build).isExactlyInstanceOf(BuildStep.class);
        assertThat(build.getPrimaryOutput().getProducer()).isSameAs(build);
    }

    @Test
    void stackDeployment_relativeTemplatePath() {
        Path root = Path.of("/work/cdk.out");
        StackDeployment stack = StackDeployment.builder("ProdStack", "Prod-Stack")
            .absoluteTemplatePath(root.resolve("assembly-Prod/ProdStack.template.json"))
            .build();

        assertThat(stack.relativeTemplatePath(root).toString().replace('\\', '/'))
            .isEqualTo("assembly-Prod/ProdStack.template.json");
    }
}
