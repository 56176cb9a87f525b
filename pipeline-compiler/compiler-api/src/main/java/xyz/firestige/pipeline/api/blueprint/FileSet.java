package xyz.firestige.pipeline.api.blueprint;

import java.util.Objects;

/**
 * 步骤之间传递的文件集合
 *
 * @since 1.0
 */
public class FileSet {

    private final String id;
    private Step producer;

    public FileSet(String id) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
    }

    public FileSet(String id, Step producer) {
        this(id);
        producedBy(producer);
    }

    /**
     * 标记产出该文件集的步骤，只能设置一次
     */
    public void producedBy(Step step) {
        if (producer != null && producer != step) {
            throw new IllegalStateException("FileSet '" + id + "' is already produced by " + producer);
        }
        this.producer = step;
    }

    public String getId() {
        return id;
    }

    public Step getProducer() {
        return producer;
    }

    @Override
    public String toString() {
        return "FileSet(" + id + (producer != null ? " <- " + producer.getId() : "") + ")";
    }
}
