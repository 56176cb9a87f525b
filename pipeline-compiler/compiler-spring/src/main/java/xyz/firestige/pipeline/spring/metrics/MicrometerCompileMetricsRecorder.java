package xyz.firestige.pipeline.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import xyz.firestige.pipeline.api.CompileMetricsRecorder;
import xyz.firestige.pipeline.api.CompileSummary;

/**
 * 基于 Micrometer 的编译指标记录器
 * <p>
 * 记录以下指标：
 * - pipeline_compile_total: 总编译次数
 * - pipeline_compile_failures: 失败次数
 * - pipeline_compile_stages: 生成的 Stage 数
 * - pipeline_compile_actions: 生成的动作数
 * - pipeline_compile_duration: 编译耗时分布
 *
 * @since 1.0
 */
public class MicrometerCompileMetricsRecorder implements CompileMetricsRecorder {

    private final Counter compilations;
    private final Counter failures;
    private final Counter stages;
    private final Counter actions;
    private final Timer compileTimer;

    public MicrometerCompileMetricsRecorder(MeterRegistry registry) {
        this.compilations = Counter.builder("pipeline_compile_total")
            .description("Total pipeline compilations")
            .register(registry);
        this.failures = Counter.builder("pipeline_compile_failures")
            .description("Failed pipeline compilations")
            .register(registry);
        this.stages = Counter.builder("pipeline_compile_stages")
            .description("Stages produced by successful compilations")
            .register(registry);
        this.actions = Counter.builder("pipeline_compile_actions")
            .description("Actions produced by successful compilations")
            .register(registry);
        this.compileTimer = Timer.builder("pipeline_compile_duration")
            .description("Pipeline compilation duration")
            .publishPercentileHistogram()
            .register(registry);
    }

    @Override
    public void record(CompileSummary summary) {
        compilations.increment();
        if (summary.success()) {
            stages.increment(summary.stageCount());
            actions.increment(summary.actionCount());
        } else {
            failures.increment();
        }
        compileTimer.record(summary.elapsed());
    }
}
