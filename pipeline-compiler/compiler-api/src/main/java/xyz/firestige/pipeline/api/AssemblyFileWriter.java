package xyz.firestige.pipeline.api;

import java.nio.file.Path;

/**
 * 向云装配目录写出辅助描述文件（模板配置、构建规格）
 */
@FunctionalInterface
public interface AssemblyFileWriter {

    /**
     * 将对象序列化为 JSON 写入指定文件，父目录不存在时自动创建
     *
     * @throws java.io.UncheckedIOException 写入失败
     */
    void writeJson(Path file, Object content);
}
