package xyz.firestige.pipeline.api.credential;

import xyz.firestige.pipeline.api.model.ExecutionRole;
import xyz.firestige.pipeline.api.model.PolicyStatement;

import java.util.List;
import java.util.Set;

/**
 * ECR 仓库凭证：授予拉取镜像的权限
 */
public class EcrRegistryCredential extends RegistryCredential {

    private final String registryDomain;
    private final List<String> repositoryArns;

    public EcrRegistryCredential(String registryDomain, List<String> repositoryArns, Set<CredentialUsage> usages) {
        super(usages);
        this.registryDomain = registryDomain;
        this.repositoryArns = List.copyOf(repositoryArns);
    }

    @Override
    protected boolean doGrantRead(ExecutionRole role) {
        boolean repositories = role.addToPolicy(PolicyStatement.builder()
            .actions("ecr:BatchCheckLayerAvailability", "ecr:GetDownloadUrlForLayer", "ecr:BatchGetImage")
            .resources(repositoryArns)
            .build());
        boolean token = role.addToPolicy(PolicyStatement.builder()
            .actions("ecr:GetAuthorizationToken")
            .resources("*")
            .build());
        return repositories && token;
    }

    @Override
    public String getRegistryDomain() {
        return registryDomain;
    }

    public List<String> getRepositoryArns() {
        return repositoryArns;
    }
}
