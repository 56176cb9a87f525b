package xyz.firestige.pipeline.api;

/**
 * 编译指标记录器
 * <p>
 * 允许接入 Micrometer 或其他监控系统
 *
 * @since 1.0
 */
@FunctionalInterface
public interface CompileMetricsRecorder {

    /**
     * 记录一次编译结果
     *
     * @param summary 编译统计
     */
    void record(CompileSummary summary);

    /**
     * 空操作实现（默认）
     */
    static CompileMetricsRecorder noop() {
        return summary -> {};
    }
}
