package xyz.firestige.pipeline.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 构建项目的可叠加默认配置
 *
 * <p>合并规则（{@link #merge(BuildOptions...)}）：
 * <ul>
 *   <li>buildEnvironment：逐字段覆盖，环境变量按 key 合并</li>
 *   <li>rolePolicy：按顺序拼接</li>
 *   <li>partialBuildSpec：深度合并，Map 递归合并，List 拼接，其余后者覆盖</li>
 *   <li>vpc：取最后一个非空值</li>
 * </ul>
 *
 * @since 1.0
 */
public class BuildOptions {

    private final BuildEnvironment buildEnvironment;
    private final List<PolicyStatement> rolePolicy;
    private final Map<String, Object> partialBuildSpec;
    private final VpcConfig vpc;

    private BuildOptions(BuildEnvironment buildEnvironment, List<PolicyStatement> rolePolicy,
                         Map<String, Object> partialBuildSpec, VpcConfig vpc) {
        this.buildEnvironment = buildEnvironment != null ? buildEnvironment : BuildEnvironment.empty();
        this.rolePolicy = rolePolicy == null ? List.of() : List.copyOf(rolePolicy);
        this.partialBuildSpec = partialBuildSpec == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(partialBuildSpec));
        this.vpc = vpc;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BuildOptions empty() {
        return new BuildOptions(null, null, null, null);
    }

    /**
     * 按顺序合并多个配置，null 参数被忽略
     */
    public static BuildOptions merge(BuildOptions... options) {
        BuildEnvironment env = BuildEnvironment.empty();
        List<PolicyStatement> statements = new ArrayList<>();
        Map<String, Object> spec = new LinkedHashMap<>();
        VpcConfig vpc = null;
        for (BuildOptions o : options) {
            if (o == null) {
                continue;
            }
            env = env.merge(o.buildEnvironment);
            statements.addAll(o.rolePolicy);
            spec = mergeSpec(spec, o.partialBuildSpec);
            if (o.vpc != null) {
                vpc = o.vpc;
            }
        }
        return new BuildOptions(env, statements, spec, vpc);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> mergeSpec(Map<String, Object> base, Map<String, Object> overlay) {
        Map<String, Object> result = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> e : overlay.entrySet()) {
            Object existing = result.get(e.getKey());
            Object incoming = e.getValue();
            if (existing instanceof Map && incoming instanceof Map) {
                result.put(e.getKey(), mergeSpec((Map<String, Object>) existing, (Map<String, Object>) incoming));
            } else if (existing instanceof List && incoming instanceof List) {
                List<Object> joined = new ArrayList<>((List<Object>) existing);
                joined.addAll((List<Object>) incoming);
                result.put(e.getKey(), joined);
            } else {
                result.put(e.getKey(), incoming);
            }
        }
        return result;
    }

    public BuildEnvironment getBuildEnvironment() {
        return buildEnvironment;
    }

    public List<PolicyStatement> getRolePolicy() {
        return rolePolicy;
    }

    public Map<String, Object> getPartialBuildSpec() {
        return partialBuildSpec;
    }

    public VpcConfig getVpc() {
        return vpc;
    }

    public static class Builder {
        private BuildEnvironment buildEnvironment;
        private final List<PolicyStatement> rolePolicy = new ArrayList<>();
        private Map<String, Object> partialBuildSpec;
        private VpcConfig vpc;

        public Builder buildEnvironment(BuildEnvironment buildEnvironment) {
            this.buildEnvironment = buildEnvironment;
            return this;
        }

        public Builder rolePolicy(PolicyStatement statement) {
            this.rolePolicy.add(statement);
            return this;
        }

        public Builder partialBuildSpec(Map<String, Object> partialBuildSpec) {
            this.partialBuildSpec = partialBuildSpec;
            return this;
        }

        public Builder vpc(VpcConfig vpc) {
            this.vpc = vpc;
            return this;
        }

        public BuildOptions build() {
            return new BuildOptions(buildEnvironment, rolePolicy, partialBuildSpec, vpc);
        }
    }
}
