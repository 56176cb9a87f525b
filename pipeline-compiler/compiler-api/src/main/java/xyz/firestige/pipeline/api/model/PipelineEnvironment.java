package xyz.firestige.pipeline.api.model;

import java.util.Objects;

/**
 * 流水线所在的账号与区域
 *
 * @param account   账号 ID
 * @param region    区域
 * @param partition 分区（如 aws、aws-cn）
 */
public record PipelineEnvironment(String account, String region, String partition) {

    public static final String DEFAULT_PARTITION = "aws";

    public PipelineEnvironment {
        Objects.requireNonNull(account, "account cannot be null");
        Objects.requireNonNull(region, "region cannot be null");
        if (partition == null || partition.isBlank()) {
            partition = DEFAULT_PARTITION;
        }
    }

    public static PipelineEnvironment of(String account, String region) {
        return new PipelineEnvironment(account, region, DEFAULT_PARTITION);
    }

    /**
     * 拼装资源 ARN
     *
     * @param service      服务名
     * @param resource     资源类型
     * @param separator    资源类型与资源名之间的分隔符（"/" 或 ":"）
     * @param resourceName 资源名
     */
    public String formatArn(String service, String resource, String separator, String resourceName) {
        return "arn:" + partition + ":" + service + ":" + region + ":" + account + ":"
            + resource + separator + resourceName;
    }
}
