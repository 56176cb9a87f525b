package xyz.firestige.pipeline.core;

import xyz.firestige.pipeline.api.graph.NodeType;
import xyz.firestige.pipeline.api.model.BuildProject;

/**
 * 编译结果中的一个已调度节点
 *
 * @param name              动作名
 * @param runOrder          执行顺序
 * @param nodeId            来源图节点 ID
 * @param nodeType          来源节点类型
 * @param runOrdersConsumed 占用的槽位数
 * @param project           创建的构建项目，可为 null
 */
public record PlannedAction(String name,
                            int runOrder,
                            String nodeId,
                            NodeType nodeType,
                            int runOrdersConsumed,
                            BuildProject project) {
}
