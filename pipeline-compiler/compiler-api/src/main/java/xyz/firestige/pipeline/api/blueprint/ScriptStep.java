package xyz.firestige.pipeline.api.blueprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 在通用构建环境中执行的脚本步骤
 *
 * @since 1.0
 */
public class ScriptStep extends Step {

    private final List<String> commands;
    private final List<String> installCommands;
    private final Map<String, String> env;
    private final FileSet input;
    private final String primaryOutputDirectory;

    protected ScriptStep(BaseBuilder<?> builder) {
        super(builder.id);
        if (builder.commands.isEmpty()) {
            throw new IllegalArgumentException("Script step '" + builder.id + "' requires at least one command");
        }
        this.commands = List.copyOf(builder.commands);
        this.installCommands = List.copyOf(builder.installCommands);
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        this.input = builder.input;
        this.primaryOutputDirectory = builder.primaryOutputDirectory;
        if (input != null) {
            addDependencyFileSet(input);
        }
        if (primaryOutputDirectory != null) {
            configurePrimaryOutput(new FileSet("Output"));
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public List<String> getCommands() {
        return commands;
    }

    public List<String> getInstallCommands() {
        return installCommands;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public FileSet getInput() {
        return input;
    }

    public String getPrimaryOutputDirectory() {
        return primaryOutputDirectory;
    }

    public abstract static class BaseBuilder<B extends BaseBuilder<B>> {
        private final String id;
        private final List<String> commands = new ArrayList<>();
        private final List<String> installCommands = new ArrayList<>();
        private final Map<String, String> env = new LinkedHashMap<>();
        private FileSet input;
        private String primaryOutputDirectory;

        protected BaseBuilder(String id) {
            this.id = id;
        }

        protected abstract B self();

        public B commands(String... commands) {
            this.commands.addAll(List.of(commands));
            return self();
        }

        public B commands(List<String> commands) {
            this.commands.addAll(commands);
            return self();
        }

        public B installCommands(String... installCommands) {
            this.installCommands.addAll(List.of(installCommands));
            return self();
        }

        public B installCommands(List<String> installCommands) {
            this.installCommands.addAll(installCommands);
            return self();
        }

        public B env(String key, String value) {
            this.env.put(key, value);
            return self();
        }

        public B input(FileSet input) {
            this.input = input;
            return self();
        }

        public B primaryOutputDirectory(String directory) {
            this.primaryOutputDirectory = directory;
            return self();
        }
    }

    public static final class Builder extends BaseBuilder<Builder> {

        private Builder(String id) {
            super(id);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public ScriptStep build() {
            return new ScriptStep(this);
        }
    }
}
