package xyz.firestige.pipeline.api.credential;

import xyz.firestige.pipeline.api.model.ExecutionRole;

import java.util.EnumSet;
import java.util.Set;

/**
 * 镜像仓库凭证
 * <p>
 * 流水线中需要访问仓库的构建项目（合成、自更新、资产发布）会被授予读取凭证的权限。
 * 凭证安装命令的生成不在本模块范围内。
 *
 * @since 1.0
 */
public abstract class RegistryCredential {

    private final Set<CredentialUsage> usages;

    /**
     * @param usages 适用场景，为空表示适用于全部场景
     */
    protected RegistryCredential(Set<CredentialUsage> usages) {
        this.usages = usages == null || usages.isEmpty()
            ? EnumSet.allOf(CredentialUsage.class)
            : EnumSet.copyOf(usages);
    }

    public boolean appliesTo(CredentialUsage usage) {
        return usages.contains(usage);
    }

    public Set<CredentialUsage> getUsages() {
        return Set.copyOf(usages);
    }

    /**
     * 按使用场景授予角色读取权限，不适用的场景直接忽略
     *
     * @return 是否产生了授权
     */
    public boolean grantRead(ExecutionRole role, CredentialUsage usage) {
        if (!appliesTo(usage)) {
            return false;
        }
        return doGrantRead(role);
    }

    protected abstract boolean doGrantRead(ExecutionRole role);

    /**
     * 仓库域名，用于日志与排查
     */
    public abstract String getRegistryDomain();
}
