package xyz.firestige.pipeline.api;

import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.api.graph.GraphArena;

import java.io.InputStream;
import java.lang.module.ModuleDescriptor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 验证 API 模块描述符导出全部契约包，且不依赖任何第三方库
 */
class ModuleDescriptorTest {

    private static ModuleDescriptor descriptorOf(Class<?> type) throws Exception {
        Path classes = Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI());
        try (InputStream in = Files.newInputStream(classes.resolve("module-info.class"))) {
            return ModuleDescriptor.read(in);
        }
    }

    @Test
    void exportsContractAndExceptionPackages() throws Exception {
        ModuleDescriptor descriptor = descriptorOf(GraphArena.class);

        Set<String> exported = descriptor.exports().stream()
            .map(ModuleDescriptor.Exports::source)
            .collect(Collectors.toSet());

        assertThat(descriptor.name()).isEqualTo("xyz.firestige.pipeline.api");
        assertThat(exported).containsExactlyInAnyOrder(
            "xyz.firestige.pipeline.api",
            "xyz.firestige.pipeline.api.blueprint",
            "xyz.firestige.pipeline.api.credential",
            "xyz.firestige.pipeline.api.graph",
            "xyz.firestige.pipeline.api.model",
            "xyz.firestige.pipeline.exception");
    }

    @Test
    void requiresOnlyJavaBase() throws Exception {
        ModuleDescriptor descriptor = descriptorOf(GraphArena.class);

        assertThat(descriptor.requires())
            .extracting(ModuleDescriptor.Requires::name)
            .containsExactly("java.base");
    }
}
