package xyz.firestige.pipeline.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import xyz.firestige.pipeline.api.AssemblyFileWriter;
import xyz.firestige.pipeline.api.CompileMetricsRecorder;
import xyz.firestige.pipeline.core.support.AssemblyContext;
import xyz.firestige.pipeline.core.support.JacksonAssemblyFileWriter;

import java.util.Objects;

/**
 * 编译器工厂
 * <p>
 * 编译器是一次性的，工厂为每次编译创建新实例，共享写出器与指标记录器。
 *
 * @since 1.0
 */
public class PipelineCompilerFactory {

    private final ObjectMapper objectMapper;
    private final AssemblyFileWriter fileWriter;
    private final CompileMetricsRecorder metricsRecorder;

    public PipelineCompilerFactory(ObjectMapper objectMapper) {
        this(objectMapper, new JacksonAssemblyFileWriter(objectMapper), CompileMetricsRecorder.noop());
    }

    public PipelineCompilerFactory(ObjectMapper objectMapper, AssemblyFileWriter fileWriter,
                                   CompileMetricsRecorder metricsRecorder) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.fileWriter = Objects.requireNonNull(fileWriter, "fileWriter cannot be null");
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : CompileMetricsRecorder.noop();
    }

    public PipelineCompiler create(CompilerOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        AssemblyContext assembly = new AssemblyContext(options.getAssemblyRoot(), fileWriter, objectMapper);
        return new PipelineCompiler(options, assembly, metricsRecorder);
    }

    public CompileMetricsRecorder getMetricsRecorder() {
        return metricsRecorder;
    }
}
