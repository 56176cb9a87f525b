package xyz.firestige.pipeline.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 流水线 Stage
 * <p>
 * 前一个 Stage 全部完成后才开始执行。
 *
 * @since 1.0
 */
public class PipelineStage {

    private final String name;
    private final List<StageAction> actions = new ArrayList<>();

    public PipelineStage(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public void addAction(StageAction action) {
        actions.add(Objects.requireNonNull(action, "action cannot be null"));
    }

    public String getName() {
        return name;
    }

    public List<StageAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    @Override
    public String toString() {
        return "PipelineStage{" + name + ", actions=" + actions.size() + '}';
    }
}
