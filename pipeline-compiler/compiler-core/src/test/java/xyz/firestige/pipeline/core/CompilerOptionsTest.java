package xyz.firestige.pipeline.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CompilerOptionsTest {

    @Test
    void defaults() {
        CompilerOptions options = CompilerFixtures.options(Path.of("cdk.out")).build();

        assertEquals(50, options.getStageCapacity());
        assertEquals("PipelineStack", options.getPipelineStackId());
        assertEquals(".", options.getEmbeddedAssemblyPath());
        assertEquals("", options.installSuffix());
        assertTrue(options.getRegistryCredentials().isEmpty());
    }

    @Test
    void artifactBucketName_derivedFromPipelineName() {
        CompilerOptions options = CompilerFixtures.options(Path.of("cdk.out")).pipelineName("My_Pipeline").build();

        assertEquals("my-pipeline-artifacts", options.getArtifactBucketName());
    }

    @Test
    void artifactBucketName_explicitWins() {
        CompilerOptions options = CompilerFixtures.options(Path.of("cdk.out")).artifactBucketName("shared-bucket").build();

        assertEquals("shared-bucket", options.getArtifactBucketName());
    }

    @Test
    void installSuffix_withCliVersion() {
        assertEquals("@2.100.0", CompilerFixtures.options(Path.of("cdk.out")).cliVersion("2.100.0").build().installSuffix());
    }

    @Test
    void missingEnvironment_throws() {
        CompilerOptions.Builder builder = CompilerOptions.builder().assemblyRoot(Path.of("cdk.out"));

        assertThrows(NullPointerException.class, builder::build);
    }

    @Test
    void nonPositiveCapacity_throws() {
        CompilerOptions.Builder builder = CompilerFixtures.options(Path.of("cdk.out")).stageCapacity(0);

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
