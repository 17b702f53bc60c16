package com.minibptree.index;

import lombok.Getter;

/**
 * 节点分裂结果
 *
 * 一次分裂产生:
 * - promotedKey: 需要插入父节点的分隔键
 * - left: 分裂前的原节点（保留左半部分）
 * - right: 新建的右节点
 *
 * @author Mini-BPTree
 */
@Getter
public class SplitResult {

    private final int promotedKey;
    private final BPlusTreeNode left;
    private final BPlusTreeNode right;

    public SplitResult(int promotedKey, BPlusTreeNode left, BPlusTreeNode right) {
        this.promotedKey = promotedKey;
        this.left = left;
        this.right = right;
    }

    @Override
    public String toString() {
        return "SplitResult{promotedKey=" + promotedKey + ", left=" + left + ", right=" + right + "}";
    }
}
