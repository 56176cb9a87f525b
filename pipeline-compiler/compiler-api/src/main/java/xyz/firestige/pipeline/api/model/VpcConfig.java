package xyz.firestige.pipeline.api.model;

import java.util.List;
import java.util.Objects;

/**
 * 构建项目所在的 VPC 网络配置
 *
 * @param vpcId            VPC ID
 * @param subnetIds        子网列表
 * @param securityGroupIds 安全组列表
 */
public record VpcConfig(String vpcId, List<String> subnetIds, List<String> securityGroupIds) {

    public VpcConfig {
        Objects.requireNonNull(vpcId, "vpcId cannot be null");
        subnetIds = subnetIds == null ? List.of() : List.copyOf(subnetIds);
        securityGroupIds = securityGroupIds == null ? List.of() : List.copyOf(securityGroupIds);
    }
}
