package xyz.firestige.pipeline.core.support;

import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.api.blueprint.FileSet;
import xyz.firestige.pipeline.api.blueprint.ScriptStep;
import xyz.firestige.pipeline.api.model.Artifact;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactMapTest {

    @Test
    void toPipelineArtifact_sameFileSet_sameArtifact() {
        ScriptStep synth = ScriptStep.builder("Synth").commands("npx cdk synth").primaryOutputDirectory("cdk.out").build();
        ArtifactMap map = new ArtifactMap();

        Artifact first = map.toPipelineArtifact(synth.getPrimaryOutput());
        Artifact second = map.toPipelineArtifact(synth.getPrimaryOutput());

        assertSame(first, second);
        assertEquals("Synth_Output", first.getName());
        assertEquals(1, map.size());
    }

    @Test
    void toPipelineArtifact_illegalCharactersReplaced() {
        ScriptStep step = ScriptStep.builder("Build App/v2").commands("make").primaryOutputDirectory("dist").build();

        assertEquals("Build_App_v2_Output", new ArtifactMap().toPipelineArtifact(step.getPrimaryOutput()).getName());
    }

    @Test
    void toPipelineArtifact_nameCollision_appendsSuffix() {
        ArtifactMap map = new ArtifactMap();

        Artifact a = map.toPipelineArtifact(new FileSet("a.b"));
        Artifact b = map.toPipelineArtifact(new FileSet("a_b"));
        Artifact c = map.toPipelineArtifact(new FileSet("a.b"));

        assertEquals("a_b", a.getName());
        assertEquals("a_b2", b.getName());
        assertEquals("a_b3", c.getName());
    }
}
