package xyz.firestige.pipeline.api.blueprint;

/**
 * 资产类型
 * <p>
 * 同一资产类型的发布动作共享一个执行角色。
 */
public enum AssetType {

    FILE("File"),

    DOCKER_IMAGE("Docker");

    private final String rolePrefix;

    AssetType(String rolePrefix) {
        this.rolePrefix = rolePrefix;
    }

    /**
     * 共享发布角色的名称前缀
     */
    public String getRolePrefix() {
        return rolePrefix;
    }
}
