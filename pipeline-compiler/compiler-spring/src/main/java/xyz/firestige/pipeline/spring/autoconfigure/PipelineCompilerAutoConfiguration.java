package xyz.firestige.pipeline.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import xyz.firestige.pipeline.api.AssemblyFileWriter;
import xyz.firestige.pipeline.api.CompileMetricsRecorder;
import xyz.firestige.pipeline.api.credential.RegistryCredential;
import xyz.firestige.pipeline.core.CompilerOptions;
import xyz.firestige.pipeline.core.PipelineCompilerFactory;
import xyz.firestige.pipeline.core.support.JacksonAssemblyFileWriter;
import xyz.firestige.pipeline.spring.metrics.MicrometerCompileMetricsRecorder;

/**
 * 流水线编译器自动配置
 *
 * @since 1.0
 */
@AutoConfiguration
@ConditionalOnClass(PipelineCompilerFactory.class)
@ConditionalOnProperty(prefix = "pipeline.compiler", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PipelineCompilerProperties.class)
public class PipelineCompilerAutoConfiguration {

    /**
     * 装配文件写出器（基于 Jackson）
     */
    @Bean
    @ConditionalOnMissingBean
    public AssemblyFileWriter assemblyFileWriter(ObjectMapper objectMapper) {
        return new JacksonAssemblyFileWriter(objectMapper);
    }

    /**
     * 编译指标记录器，存在 MeterRegistry 时使用 Micrometer
     */
    @Bean
    @ConditionalOnMissingBean
    public CompileMetricsRecorder compileMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry registry = meterRegistryProvider.getIfAvailable();
        return registry != null
            ? new MicrometerCompileMetricsRecorder(registry)
            : CompileMetricsRecorder.noop();
    }

    /**
     * 编译器工厂
     */
    @Bean
    @ConditionalOnMissingBean
    public PipelineCompilerFactory pipelineCompilerFactory(ObjectMapper objectMapper,
                                                           AssemblyFileWriter assemblyFileWriter,
                                                           CompileMetricsRecorder compileMetricsRecorder) {
        return new PipelineCompilerFactory(objectMapper, assemblyFileWriter, compileMetricsRecorder);
    }

    /**
     * 编译选项，配置了账号与区域时才装配；容器中的仓库凭证按顺序加入
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pipeline.compiler.environment", name = {"account", "region"})
    public CompilerOptions compilerOptions(PipelineCompilerProperties properties,
                                           ObjectProvider<RegistryCredential> registryCredentials) {
        return properties.toCompilerOptions()
            .registryCredentials(registryCredentials.orderedStream().toList())
            .build();
    }

    /**
     * ObjectMapper（如果不存在则创建）
     */
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
