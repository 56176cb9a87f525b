package xyz.firestige.pipeline.api.model;

import xyz.firestige.pipeline.exception.PipelineValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 交付服务中的流水线句柄
 *
 * @since 1.0
 */
public class Pipeline {

    private final String name;
    private final boolean crossAccountKeys;
    private final boolean restartExecutionOnUpdate;
    private final ArtifactStore artifactStore;
    private final List<PipelineStage> stages = new ArrayList<>();

    public Pipeline(String name, boolean crossAccountKeys, boolean restartExecutionOnUpdate,
                    ArtifactStore artifactStore) {
        this.name = name;
        this.crossAccountKeys = crossAccountKeys;
        this.restartExecutionOnUpdate = restartExecutionOnUpdate;
        this.artifactStore = Objects.requireNonNull(artifactStore, "artifactStore cannot be null");
    }

    /**
     * 追加 Stage，名称在流水线内必须唯一
     */
    public PipelineStage addStage(String stageName) {
        if (getStage(stageName).isPresent()) {
            throw new PipelineValidationException("Duplicate stage name '" + stageName + "'");
        }
        PipelineStage stage = new PipelineStage(stageName);
        stages.add(stage);
        return stage;
    }

    public Optional<PipelineStage> getStage(String stageName) {
        return stages.stream().filter(s -> s.getName().equals(stageName)).findFirst();
    }

    /**
     * 流水线名称，未指定时为 null（由交付服务生成）
     */
    public String getName() {
        return name;
    }

    public boolean isCrossAccountKeys() {
        return crossAccountKeys;
    }

    public boolean isRestartExecutionOnUpdate() {
        return restartExecutionOnUpdate;
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    public List<PipelineStage> getStages() {
        return Collections.unmodifiableList(stages);
    }
}
