package xyz.firestige.pipeline.core.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.pipeline.api.AssemblyFileWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 基于 Jackson 的装配文件写出器
 */
public class JacksonAssemblyFileWriter implements AssemblyFileWriter {

    private static final Logger log = LoggerFactory.getLogger(JacksonAssemblyFileWriter.class);

    private final ObjectMapper objectMapper;

    public JacksonAssemblyFileWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    @Override
    public void writeJson(Path file, Object content) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(file.toFile(), content);
            log.debug("Wrote assembly file {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write assembly file " + file, e);
        }
    }
}
