package xyz.firestige.pipeline.core.support;

import xyz.firestige.pipeline.api.ArtifactResolver;
import xyz.firestige.pipeline.api.blueprint.FileSet;
import xyz.firestige.pipeline.api.model.Artifact;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 文件集到流水线制品的映射
 * <p>
 * 制品名由 {@code <产出步骤ID>.<文件集ID>} 清洗后得到，重名时追加递增序号。
 */
public class ArtifactMap implements ArtifactResolver {

    private static final Pattern ILLEGAL_CHARS = Pattern.compile("[^A-Za-z0-9@\\-_]");

    private final Map<FileSet, Artifact> artifacts = new LinkedHashMap<>();
    private final Set<String> usedNames = new HashSet<>();

    @Override
    public Artifact toPipelineArtifact(FileSet fileSet) {
        return artifacts.computeIfAbsent(fileSet, fs -> new Artifact(uniqueName(baseName(fs))));
    }

    public int size() {
        return artifacts.size();
    }

    private static String baseName(FileSet fileSet) {
        String raw = fileSet.getProducer() != null
            ? fileSet.getProducer().getId() + "." + fileSet.getId()
            : fileSet.getId();
        return ILLEGAL_CHARS.matcher(raw).replaceAll("_");
    }

    private String uniqueName(String baseName) {
        String name = baseName;
        int i = 1;
        while (usedNames.contains(name)) {
            name = baseName + (++i);
        }
        usedNames.add(name);
        return name;
    }
}
