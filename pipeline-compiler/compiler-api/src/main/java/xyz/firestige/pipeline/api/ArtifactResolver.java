package xyz.firestige.pipeline.api;

import xyz.firestige.pipeline.api.blueprint.FileSet;
import xyz.firestige.pipeline.api.model.Artifact;

/**
 * 文件集到流水线制品的映射
 */
public interface ArtifactResolver {

    /**
     * 返回文件集对应的制品，同一文件集始终返回同一个制品
     */
    Artifact toPipelineArtifact(FileSet fileSet);
}
