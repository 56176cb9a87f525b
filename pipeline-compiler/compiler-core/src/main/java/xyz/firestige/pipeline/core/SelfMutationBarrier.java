package xyz.firestige.pipeline.core;

/**
 * 自更新屏障
 * <p>
 * 初始值为是否启用自更新；调度到第一个自更新节点后永久变为 false。
 * 只作为信息传递给各个动作生产者，不改变调度顺序。
 */
public class SelfMutationBarrier {

    private boolean beforeSelfMutation;

    public SelfMutationBarrier(boolean selfMutationEnabled) {
        this.beforeSelfMutation = selfMutationEnabled;
    }

    /**
     * 当前调度的动作是否在流水线自更新之前执行
     */
    public boolean isBeforeSelfMutation() {
        return beforeSelfMutation;
    }

    /**
     * 自更新节点已调度
     */
    public void clear() {
        beforeSelfMutation = false;
    }
}
