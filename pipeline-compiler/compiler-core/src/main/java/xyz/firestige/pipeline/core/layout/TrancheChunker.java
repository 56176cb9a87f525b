package xyz.firestige.pipeline.core.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * 分层切块器
 * <p>将有序的 tranche 序列按容量切分成若干 Stage 分组
 *
 * <p>规则：
 * <ul>
 *   <li>每个分组内节点总数不超过容量</li>
 *   <li>不重排：依次拼接所有分组即得到原序列</li>
 *   <li>tranche 能放进当前分组剩余空间时整体放入，否则只放入能容纳的前缀，
 *       剩余后缀作为一个新的 tranche 进入下一个分组</li>
 *   <li>当前分组已满时直接关闭，不会产生空的前缀</li>
 * </ul>
 *
 * @since 1.0
 */
public class TrancheChunker {

    /** Stage 内动作数量上限 */
    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;

    public TrancheChunker() {
        this(DEFAULT_CAPACITY);
    }

    public TrancheChunker(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * 切分 tranche 序列，输入不会被修改
     *
     * @param tranches 有序 tranche 序列
     * @return 分组序列，每个分组是一段 tranche 序列
     */
    public <T> List<List<List<T>>> chunk(List<? extends List<T>> tranches) {
        List<List<List<T>>> groups = new ArrayList<>();
        if (tranches == null || tranches.isEmpty()) {
            return groups;
        }

        List<List<T>> current = new ArrayList<>();
        int count = 0;
        for (List<T> tranche : tranches) {
            int offset = 0;
            int remaining = tranche.size();
            while (remaining > capacity - count) {
                int space = capacity - count;
                if (space > 0) {
                    current.add(new ArrayList<>(tranche.subList(offset, offset + space)));
                    offset += space;
                    remaining -= space;
                }
                groups.add(current);
                current = new ArrayList<>();
                count = 0;
            }
            current.add(new ArrayList<>(tranche.subList(offset, tranche.size())));
            count += remaining;
        }

        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    public int getCapacity() {
        return capacity;
    }
}
