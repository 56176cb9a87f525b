package xyz.firestige.pipeline.spring.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.api.CompileSummary;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerCompileMetricsRecorderTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerCompileMetricsRecorder recorder = new MicrometerCompileMetricsRecorder(registry);

    @Test
    void record_success_countsStagesAndActions() {
        recorder.record(new CompileSummary("orders", 3, 12, 1, Duration.ofMillis(40), true));

        assertThat(registry.get("pipeline_compile_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("pipeline_compile_stages").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("pipeline_compile_actions").counter().count()).isEqualTo(12.0);
        assertThat(registry.get("pipeline_compile_failures").counter().count()).isZero();
        assertThat(registry.get("pipeline_compile_duration").timer().count()).isEqualTo(1);
    }

    @Test
    void record_failure_countsFailure() {
        recorder.record(CompileSummary.failed("orders", Duration.ofMillis(5)));

        assertThat(registry.get("pipeline_compile_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("pipeline_compile_failures").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("pipeline_compile_actions").counter().count()).isZero();
    }
}
