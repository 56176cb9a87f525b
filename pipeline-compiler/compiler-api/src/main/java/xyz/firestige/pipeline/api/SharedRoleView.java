package xyz.firestige.pipeline.api;

import xyz.firestige.pipeline.api.blueprint.AssetType;
import xyz.firestige.pipeline.api.model.ExecutionRole;

import java.util.Optional;
import java.util.Set;

/**
 * 共享执行角色的只读视图
 * <p>
 * 编译结束后视图被关闭，再次访问抛出 {@link IllegalStateException}。
 *
 * @since 1.0
 */
public interface SharedRoleView {

    /**
     * 某资产类型已创建的共享发布角色
     */
    Optional<ExecutionRole> roleFor(AssetType assetType);

    /**
     * 某资产类型目前登记的、需要被扮演的发布角色 ARN
     */
    Set<String> publishingRolesFor(AssetType assetType);

    boolean isClosed();
}
