package xyz.firestige.pipeline.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 执行身份（角色）
 *
 * <p>三种形态：
 * <ul>
 *   <li>可变角色：{@link #create(String, String...)} 创建，可继续追加权限声明</li>
 *   <li>冻结视图：{@link #withoutPolicyUpdates()} 返回，与原角色共享声明列表，但 {@link #addToPolicy} 不再生效</li>
 *   <li>导入角色：{@link #fromArn(String)} 引用外部已存在的角色，同样不可修改</li>
 * </ul>
 *
 * @since 1.0
 */
public class ExecutionRole {

    private final String name;
    private final String arn;
    private final List<String> assumedBy;
    private final List<PolicyStatement> statements;
    private final List<AttachedPolicy> attachedPolicies;
    private final boolean frozen;

    private ExecutionRole(String name, String arn, List<String> assumedBy,
                          List<PolicyStatement> statements, List<AttachedPolicy> attachedPolicies,
                          boolean frozen) {
        this.name = name;
        this.arn = arn;
        this.assumedBy = assumedBy;
        this.statements = statements;
        this.attachedPolicies = attachedPolicies;
        this.frozen = frozen;
    }

    /**
     * 创建新角色
     *
     * @param name 角色名
     * @param principals 可扮演该角色的主体
     */
    public static ExecutionRole create(String name, String... principals) {
        Objects.requireNonNull(name, "name cannot be null");
        return new ExecutionRole(name, null, List.of(principals),
            new ArrayList<>(), new ArrayList<>(), false);
    }

    /**
     * 引用外部角色（不可修改）
     */
    public static ExecutionRole fromArn(String arn) {
        Objects.requireNonNull(arn, "arn cannot be null");
        String name = arn.substring(arn.lastIndexOf('/') + 1);
        return new ExecutionRole(name, arn, List.of(), new ArrayList<>(), new ArrayList<>(), true);
    }

    /**
     * 追加权限声明
     *
     * @return 是否真正追加（冻结视图与导入角色返回 false）
     */
    public boolean addToPolicy(PolicyStatement statement) {
        if (frozen) {
            return false;
        }
        statements.add(Objects.requireNonNull(statement, "statement cannot be null"));
        return true;
    }

    public boolean attachInlinePolicy(AttachedPolicy policy) {
        if (frozen) {
            return false;
        }
        attachedPolicies.add(Objects.requireNonNull(policy, "policy cannot be null"));
        return true;
    }

    /**
     * 冻结视图：之后通过该视图的授权都会被忽略，已授予的基线权限保持不变
     */
    public ExecutionRole withoutPolicyUpdates() {
        if (frozen) {
            return this;
        }
        return new ExecutionRole(name, arn, assumedBy, statements, attachedPolicies, true);
    }

    public String getName() {
        return name;
    }

    public String getArn() {
        return arn;
    }

    public boolean isImported() {
        return arn != null;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public List<String> getAssumedBy() {
        return assumedBy;
    }

    public List<PolicyStatement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public List<AttachedPolicy> getAttachedPolicies() {
        return Collections.unmodifiableList(attachedPolicies);
    }

    /**
     * 对角色及其附加策略中的延迟声明定稿
     */
    public void finalizeStatements() {
        statements.forEach(PolicyStatement::finalizeResources);
        attachedPolicies.forEach(p -> p.getStatements().forEach(PolicyStatement::finalizeResources));
    }

    @Override
    public String toString() {
        return "ExecutionRole{" + (arn != null ? arn : name) + (frozen ? ", frozen" : "") + '}';
    }
}
