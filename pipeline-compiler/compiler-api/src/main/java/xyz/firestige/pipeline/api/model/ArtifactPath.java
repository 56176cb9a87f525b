package xyz.firestige.pipeline.api.model;

/**
 * 制品中的文件位置
 *
 * @param artifact 所在制品
 * @param fileName 制品内的相对路径（POSIX 分隔符）
 */
public record ArtifactPath(Artifact artifact, String fileName) {

    public String location() {
        return artifact.getName() + "::" + fileName;
    }
}
