package xyz.firestige.pipeline.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 权限声明
 *
 * <p>资源列表有两种形态：
 * <ul>
 *   <li>静态资源：构建时即确定</li>
 *   <li>延迟资源：由 {@link Supplier} 在 {@link #finalizeResources()} 时求值一次，
 *       用于直到整个编译结束才能确定的资源集合（例如某类资产需要扮演的全部发布角色）</li>
 * </ul>
 * 延迟资源在定稿前读取会抛出 {@link IllegalStateException}，避免权限被过早快照而授予不足。
 *
 * @since 1.0
 */
public class PolicyStatement {

    private final List<String> actions;
    private final List<String> staticResources;
    private final Supplier<List<String>> deferredResources;
    private final Map<String, Map<String, Object>> conditions;

    private List<String> resolvedResources;

    private PolicyStatement(Builder builder) {
        this.actions = List.copyOf(builder.actions);
        this.staticResources = List.copyOf(builder.resources);
        this.deferredResources = builder.deferredResources;
        this.conditions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.conditions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getActions() {
        return actions;
    }

    /**
     * 读取资源列表
     *
     * @throws IllegalStateException 延迟资源尚未定稿
     */
    public List<String> getResources() {
        if (deferredResources == null) {
            return staticResources;
        }
        if (resolvedResources == null) {
            throw new IllegalStateException(
                "Deferred resources of statement " + actions + " read before finalization");
        }
        return resolvedResources;
    }

    public Map<String, Map<String, Object>> getConditions() {
        return conditions;
    }

    public boolean isDeferred() {
        return deferredResources != null;
    }

    public boolean isFinalized() {
        return deferredResources == null || resolvedResources != null;
    }

    /**
     * 对延迟资源求值并固化（幂等，只求值一次）
     */
    public void finalizeResources() {
        if (deferredResources != null && resolvedResources == null) {
            List<String> produced = deferredResources.get();
            List<String> merged = new ArrayList<>(staticResources);
            if (produced != null) {
                merged.addAll(produced);
            }
            this.resolvedResources = List.copyOf(merged);
        }
    }

    @Override
    public String toString() {
        return "PolicyStatement{" +
                "actions=" + actions +
                ", resources=" + (isFinalized() ? getResources() : "<deferred>") +
                (conditions.isEmpty() ? "" : ", conditions=" + conditions) +
                '}';
    }

    public static class Builder {
        private final List<String> actions = new ArrayList<>();
        private final List<String> resources = new ArrayList<>();
        private final Map<String, Map<String, Object>> conditions = new LinkedHashMap<>();
        private Supplier<List<String>> deferredResources;

        public Builder actions(String... actions) {
            this.actions.addAll(List.of(actions));
            return this;
        }

        public Builder resources(String... resources) {
            this.resources.addAll(List.of(resources));
            return this;
        }

        public Builder resources(List<String> resources) {
            this.resources.addAll(resources);
            return this;
        }

        public Builder deferredResources(Supplier<List<String>> supplier) {
            this.deferredResources = Objects.requireNonNull(supplier, "supplier cannot be null");
            return this;
        }

        public Builder condition(String operator, String key, Object value) {
            this.conditions.computeIfAbsent(operator, k -> new LinkedHashMap<>()).put(key, value);
            return this;
        }

        public PolicyStatement build() {
            if (actions.isEmpty()) {
                throw new IllegalArgumentException("Policy statement requires at least one action");
            }
            return new PolicyStatement(this);
        }
    }
}
