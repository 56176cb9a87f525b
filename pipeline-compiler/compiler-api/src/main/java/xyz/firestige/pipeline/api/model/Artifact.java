package xyz.firestige.pipeline.api.model;

import java.util.Objects;

/**
 * 流水线制品（在动作之间传递的文件集合）
 *
 * @since 1.0
 */
public final class Artifact {

    private final String name;

    public Artifact(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public String getName() {
        return name;
    }

    /**
     * 制品内部的某个文件
     */
    public ArtifactPath atPath(String fileName) {
        return new ArtifactPath(this, fileName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Artifact)) return false;
        return name.equals(((Artifact) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Artifact(" + name + ")";
    }
}
