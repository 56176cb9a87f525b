package xyz.firestige.pipeline.exception;

/**
 * 图结构异常
 * 分层后的图中出现了不应被调度的容器节点，属于上游缺陷，不可恢复
 *
 * @since 1.0
 */
public class GraphStructureException extends PipelineCompileException {

    public GraphStructureException(String message) {
        super(message, ErrorType.STRUCTURAL_ERROR);
    }

    public GraphStructureException(String message, Throwable cause) {
        super(message, ErrorType.STRUCTURAL_ERROR, cause);
    }
}
