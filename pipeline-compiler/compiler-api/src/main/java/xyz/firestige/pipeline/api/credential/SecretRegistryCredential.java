package xyz.firestige.pipeline.api.credential;

import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.PolicyStatement;

import java.util.Objects;
import java.util.Set;

/**
 * 基于密钥的仓库凭证（如 Docker Hub）：授予读取密钥值的权限
 */
public class SecretRegistryCredential extends RegistryCredential {

    private final String registryDomain;
    private final String secretArn;

    public SecretRegistryCredential(String registryDomain, String secretArn, Set<CredentialUsage> usages) {
        super(usages);
        this.registryDomain = Objects.requireNonNull(registryDomain, "registryDomain cannot be null");
        this.secretArn = Objects.requireNonNull(secretArn, "secretArn cannot be null");
    }

    @Override
    protected boolean doGrantRead(ExecutionRole role) {
        return role.addToPolicy(PolicyStatement.builder()
            .actions("secretsmanager:GetSecretValue", "secretsmanager:DescribeSecret")
            .resources(secretArn)
            .build());
    }

    @Override
    public String getRegistryDomain() {
        return registryDomain;
    }

    public String getSecretArn() {
        return secretArn;
    }
}
