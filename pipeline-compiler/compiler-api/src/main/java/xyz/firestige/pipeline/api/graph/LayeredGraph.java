package xyz.firestige.pipeline.api.graph;

import xyz.firestige.pipeline.api.blueprint.FileSet;

import java.util.List;
import java.util.Objects;

/**
 * 编译器的输入：分层完成的依赖图
 *
 * @param arena               节点仓库
 * @param containers          顶层容器，按声明顺序
 * @param cloudAssemblyFileSet 合成步骤产出的云装配文件集
 */
public record LayeredGraph(GraphArena arena, List<GraphContainer> containers, FileSet cloudAssemblyFileSet) {

    public LayeredGraph {
        Objects.requireNonNull(arena, "arena cannot be null");
        Objects.requireNonNull(cloudAssemblyFileSet, "cloudAssemblyFileSet cannot be null");
        containers = containers == null ? List.of() : List.copyOf(containers);
    }
}
