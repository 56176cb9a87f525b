package xyz.firestige.pipeline.core.cache;

import xyz.firestige.pipeline.api.model.AttachedPolicy;
import xyz.firestige.pipeline.api.model.ExecutionRole;

/**
 * 某资产类型共享的执行身份
 *
 * @param role       冻结视图，之后的授权请求不会修改它
 * @param dependable 使用该角色的构建项目需要依赖的附加策略，可为 null
 */
public record SharedAssetRole(ExecutionRole role, AttachedPolicy dependable) {
}
