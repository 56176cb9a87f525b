package xyz.firestige.pipeline.core.layout;

/**
 * Stage 内的执行顺序分配器
 * <p>
 * 同一 tranche 内的所有节点拿到相同的 runOrder；tranche 结束后游标前进该 tranche 内
 * 节点报告的最大占用槽位数。空 tranche 不推进游标。
 * <p>
 * 每个 Stage 使用一个新实例，非线程安全。
 *
 * @since 1.0
 */
public class RunOrderAllocator {

    private int cursor = 1;
    private int maxConsumed = 0;

    /**
     * 当前 tranche 的执行顺序
     */
    public int current() {
        return cursor;
    }

    /**
     * 记录 tranche 内某个节点占用的槽位数
     */
    public void record(int runOrdersConsumed) {
        if (runOrdersConsumed < 0) {
            throw new IllegalArgumentException("runOrdersConsumed cannot be negative: " + runOrdersConsumed);
        }
        maxConsumed = Math.max(maxConsumed, runOrdersConsumed);
    }

    /**
     * 结束当前 tranche
     *
     * @return 下一个 tranche 的执行顺序
     */
    public int advance() {
        cursor += maxConsumed;
        maxConsumed = 0;
        return cursor;
    }
}
