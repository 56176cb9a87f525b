package xyz.firestige.pipeline.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stage 内的一个具体动作
 * <p>
 * 同一 Stage 中 runOrder 相同的动作并发执行，runOrder 更大的动作在所有更小 runOrder 的动作完成后才开始。
 *
 * @since 1.0
 */
public class StageAction {

    private final String name;
    private final int runOrder;
    private final ActionCategory category;
    private final Map<String, Object> configuration;
    private final List<Artifact> inputs;
    private final List<Artifact> outputs;
    private final ExecutionRole role;
    private final String region;
    private final String variablesNamespace;

    private StageAction(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name cannot be null");
        this.category = Objects.requireNonNull(builder.category, "category cannot be null");
        if (builder.runOrder < 1) {
            throw new IllegalArgumentException("runOrder must be >= 1, got " + builder.runOrder + " for action " + name);
        }
        this.runOrder = builder.runOrder;
        this.configuration = Collections.unmodifiableMap(new LinkedHashMap<>(builder.configuration));
        this.inputs = List.copyOf(builder.inputs);
        this.outputs = List.copyOf(builder.outputs);
        this.role = builder.role;
        this.region = builder.region;
        this.variablesNamespace = builder.variablesNamespace;
    }

    public static Builder builder(String name, ActionCategory category) {
        return new Builder(name, category);
    }

    public String getName() {
        return name;
    }

    public int getRunOrder() {
        return runOrder;
    }

    public ActionCategory getCategory() {
        return category;
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    public List<Artifact> getInputs() {
        return inputs;
    }

    public List<Artifact> getOutputs() {
        return outputs;
    }

    public ExecutionRole getRole() {
        return role;
    }

    public String getRegion() {
        return region;
    }

    public String getVariablesNamespace() {
        return variablesNamespace;
    }

    @Override
    public String toString() {
        return "StageAction{" + name + ", runOrder=" + runOrder + ", category=" + category + '}';
    }

    public static class Builder {
        private final String name;
        private final ActionCategory category;
        private int runOrder = 1;
        private final Map<String, Object> configuration = new LinkedHashMap<>();
        private final List<Artifact> inputs = new ArrayList<>();
        private final List<Artifact> outputs = new ArrayList<>();
        private ExecutionRole role;
        private String region;
        private String variablesNamespace;

        private Builder(String name, ActionCategory category) {
            this.name = name;
            this.category = category;
        }

        public Builder runOrder(int runOrder) {
            this.runOrder = runOrder;
            return this;
        }

        /**
         * 配置项，值为 null 时忽略
         */
        public Builder configuration(String key, Object value) {
            if (value != null) {
                this.configuration.put(key, value);
            }
            return this;
        }

        public Builder input(Artifact artifact) {
            if (artifact != null) {
                this.inputs.add(artifact);
            }
            return this;
        }

        public Builder output(Artifact artifact) {
            if (artifact != null) {
                this.outputs.add(artifact);
            }
            return this;
        }

        public Builder role(ExecutionRole role) {
            this.role = role;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder variablesNamespace(String variablesNamespace) {
            this.variablesNamespace = variablesNamespace;
            return this;
        }

        public StageAction build() {
            return new StageAction(this);
        }
    }
}
