package xyz.firestige.pipeline.api.blueprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 流水线中的一个步骤（蓝图层，与具体交付服务无关）
 * <p>
 * 若步骤同时实现了 {@link xyz.firestige.pipeline.api.ActionProducer}，编译器直接委托给它产出动作；
 * 否则只支持 {@link ScriptStep}、{@link BuildStep} 与 {@link ManualApprovalStep}。
 *
 * @since 1.0
 */
public abstract class Step {

    private final String id;
    private FileSet primaryOutput;
    private final List<FileSet> dependencyFileSets = new ArrayList<>();

    protected Step(String id) {
        Objects.requireNonNull(id, "id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Step id cannot be blank");
        }
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * 步骤的主产出，没有时为 null
     */
    public FileSet getPrimaryOutput() {
        return primaryOutput;
    }

    /**
     * 步骤消费的文件集合
     */
    public List<FileSet> getDependencyFileSets() {
        return Collections.unmodifiableList(dependencyFileSets);
    }

    protected void addDependencyFileSet(FileSet fileSet) {
        if (!dependencyFileSets.contains(fileSet)) {
            dependencyFileSets.add(fileSet);
        }
    }

    protected void configurePrimaryOutput(FileSet fileSet) {
        fileSet.producedBy(this);
        this.primaryOutput = fileSet;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + id + ")";
    }
}
