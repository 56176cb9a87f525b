package xyz.firestige.pipeline.api;

import java.time.Duration;

/**
 * 一次编译的统计结果
 *
 * @param pipelineName    流水线名
 * @param stageCount      阶段数
 * @param actionCount     动作数
 * @param sharedRoleCount 共享角色数
 * @param elapsed         耗时
 * @param success         是否成功
 */
public record CompileSummary(String pipelineName,
                             int stageCount,
                             int actionCount,
                             int sharedRoleCount,
                             Duration elapsed,
                             boolean success) {

    public static CompileSummary failed(String pipelineName, Duration elapsed) {
        return new CompileSummary(pipelineName, 0, 0, 0, elapsed, false);
    }
}
