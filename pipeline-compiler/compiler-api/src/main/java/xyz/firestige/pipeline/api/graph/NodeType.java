package xyz.firestige.pipeline.api.graph;

/**
 * 图节点负载类型
 */
public enum NodeType {

    /** 普通分组（调度时不应出现） */
    GROUP,

    /** 栈分组（调度时不应出现） */
    STACK_GROUP,

    /** 流水线自更新 */
    SELF_UPDATE,

    /** 发布资产 */
    PUBLISH_ASSETS,

    /** 创建变更集 */
    PREPARE,

    /** 执行变更集 */
    EXECUTE,

    /** 用户步骤 */
    STEP
}
