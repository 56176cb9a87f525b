package xyz.firestige.pipeline.api.model;

import java.util.List;
import java.util.Objects;

/**
 * 附加在角色上的独立策略
 * <p>
 * 角色被冻结后仍需要的额外权限以独立策略的形式挂载，使用该角色的构建项目必须显式依赖它。
 *
 * @since 1.0
 */
public class AttachedPolicy {

    private final String name;
    private final List<PolicyStatement> statements;

    public AttachedPolicy(String name, List<PolicyStatement> statements) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.statements = List.copyOf(statements);
    }

    public String getName() {
        return name;
    }

    public List<PolicyStatement> getStatements() {
        return statements;
    }

    @Override
    public String toString() {
        return "AttachedPolicy{" + name + ", statements=" + statements.size() + '}';
    }
}
