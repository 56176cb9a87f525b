package xyz.firestige.pipeline.api.model;

import java.util.Objects;

/**
 * 流水线制品存储桶
 *
 * @since 1.0
 */
public class ArtifactStore {

    private final String bucketName;
    private final PipelineEnvironment environment;

    public ArtifactStore(String bucketName, PipelineEnvironment environment) {
        this.bucketName = Objects.requireNonNull(bucketName, "bucketName cannot be null");
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
    }

    public String getBucketName() {
        return bucketName;
    }

    public String getBucketArn() {
        return "arn:" + environment.partition() + ":s3:::" + bucketName;
    }

    /**
     * 授予角色读取制品的权限
     *
     * @return 角色是否接受了授权
     */
    public boolean grantRead(ExecutionRole role) {
        return role.addToPolicy(PolicyStatement.builder()
            .actions("s3:GetObject*", "s3:GetBucket*", "s3:List*")
            .resources(getBucketArn(), getBucketArn() + "/*")
            .build());
    }
}
