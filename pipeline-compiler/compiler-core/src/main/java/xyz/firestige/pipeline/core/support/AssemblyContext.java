package xyz.firestige.pipeline.core.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import xyz.firestige.pipeline.api.AssemblyFileWriter;

import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 云装配目录相关的辅助操作：相对路径计算、辅助文件写出、配置摘要
 */
public class AssemblyContext {

    private final Path root;
    private final AssemblyFileWriter writer;
    private final ObjectMapper objectMapper;

    public AssemblyContext(Path root, AssemblyFileWriter writer, ObjectMapper objectMapper) {
        this.root = Objects.requireNonNull(root, "root cannot be null").toAbsolutePath().normalize();
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null").copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public Path getRoot() {
        return root;
    }

    /**
     * 相对于装配根目录的 POSIX 路径
     */
    public String relativize(Path file) {
        return toPosix(root.relativize(file.toAbsolutePath().normalize()));
    }

    /**
     * 写入装配目录下的文件
     *
     * @param relativePath 相对于根目录的路径
     * @return 写入的 POSIX 相对路径
     */
    public String writeJson(String relativePath, Object content) {
        Path target = root.resolve(relativePath);
        writer.writeJson(target, content);
        return relativize(target);
    }

    public void writeJson(Path absolutePath, Object content) {
        writer.writeJson(absolutePath, content);
    }

    /**
     * 对象 JSON 序列化后的 SHA-256 摘要，Map 按键排序保证稳定
     */
    public String hash(Object content) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(content);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Content cannot be serialized for hashing", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String toPosix(Path path) {
        return path.toString().replace('\\', '/');
    }
}
