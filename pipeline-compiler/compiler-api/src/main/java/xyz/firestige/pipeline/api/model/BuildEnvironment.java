package xyz.firestige.pipeline.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 构建环境（部分配置，可与其他环境合并）
 * <p>
 * 为 null 的字段表示"未指定"，合并时由后者覆盖前者的已指定字段，环境变量按 key 合并。
 *
 * @since 1.0
 */
public class BuildEnvironment {

    public static final String STANDARD_5_0 = "aws/codebuild/standard:5.0";
    public static final String COMPUTE_SMALL = "BUILD_GENERAL1_SMALL";

    private final String buildImage;
    private final String computeType;
    private final Boolean privileged;
    private final Map<String, String> environmentVariables;

    public BuildEnvironment(String buildImage, String computeType, Boolean privileged,
                            Map<String, String> environmentVariables) {
        this.buildImage = buildImage;
        this.computeType = computeType;
        this.privileged = privileged;
        this.environmentVariables = environmentVariables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(environmentVariables));
    }

    public static BuildEnvironment empty() {
        return new BuildEnvironment(null, null, null, null);
    }

    public static BuildEnvironment privileged(boolean privileged) {
        return new BuildEnvironment(null, null, privileged, null);
    }

    /**
     * 合并：other 中已指定的字段覆盖当前值
     */
    public BuildEnvironment merge(BuildEnvironment other) {
        if (other == null) {
            return this;
        }
        Map<String, String> vars = new LinkedHashMap<>(environmentVariables);
        vars.putAll(other.environmentVariables);
        return new BuildEnvironment(
            other.buildImage != null ? other.buildImage : buildImage,
            other.computeType != null ? other.computeType : computeType,
            other.privileged != null ? other.privileged : privileged,
            vars);
    }

    public String getBuildImage() {
        return buildImage;
    }

    public String getComputeType() {
        return computeType;
    }

    public Boolean getPrivileged() {
        return privileged;
    }

    public boolean isPrivileged() {
        return Boolean.TRUE.equals(privileged);
    }

    public Map<String, String> getEnvironmentVariables() {
        return environmentVariables;
    }

    @Override
    public String toString() {
        return "BuildEnvironment{" +
                "buildImage='" + buildImage + '\'' +
                ", computeType='" + computeType + '\'' +
                ", privileged=" + privileged +
                ", environmentVariables=" + environmentVariables.keySet() +
                '}';
    }
}
