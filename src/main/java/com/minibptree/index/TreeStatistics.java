package com.minibptree.index;

import lombok.Data;

/**
 * B+ 树的统计信息
 *
 * 由 {@link BPlusTree#collectStatistics()} 生成的快照，不随树的变化而更新
 *
 * @author Mini-BPTree
 */
@Data
public class TreeStatistics {

    /**
     * 阶数
     */
    private int order;

    /**
     * 键值对数量
     */
    private int size;

    /**
     * 树的高度，空树为 0
     */
    private int height;

    /**
     * 叶子节点数量
     */
    private int leafCount;

    /**
     * 内部节点数量
     */
    private int internalCount;

    /**
     * 累计叶子分裂次数
     */
    private long leafSplits;

    /**
     * 累计内部节点分裂次数
     */
    private long internalSplits;

    /**
     * 累计根节点分裂次数
     */
    private long rootSplits;

    /**
     * 节点总数
     *
     * @return 叶子节点 + 内部节点
     */
    public int getNodeCount() {
        return leafCount + internalCount;
    }

    /**
     * 叶子平均填充率
     *
     * 填充率 = 键值对数量 / (叶子数量 * (order - 1))
     *
     * @return 填充率，空树返回 0
     */
    public double getLeafFillFactor() {
        if (leafCount == 0 || order <= 1) {
            return 0.0;
        }
        return (double) size / ((long) leafCount * (order - 1));
    }
}
