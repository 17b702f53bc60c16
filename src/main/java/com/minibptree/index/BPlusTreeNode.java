package com.minibptree.index;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * B+ 树节点（BPlusTreeNode）
 *
 * 节点是一个带类型标记的结构，只有两种形态：
 * 1. 叶子节点（{@link LeafNode}）：键 + 值 + 指向下一个叶子的链表指针
 * 2. 内部节点（{@link InternalNode}）：分隔键 + 子节点引用
 *
 * 使用方通过 {@link #getNodeType()} 显式判断类型，
 * 再用 {@link #asLeaf()} / {@link #asInternal()} 取得具体形态。
 *
 * 与常见实现不同，节点不保存父节点指针：
 * 父节点由插入时记录的祖先栈提供，或者通过 {@link BPlusTree#findParent} 从根向下查找。
 *
 * 节点之间只按引用（identity）比较，不覆盖 equals / hashCode。
 *
 * @author Mini-BPTree
 */
@Getter
public abstract class BPlusTreeNode {

    /**
     * 节点类型
     */
    private final NodeType nodeType;

    /**
     * 键列表（严格递增）
     * - 对于叶子节点：存储实际的键
     * - 对于内部节点：存储分隔键
     */
    protected final List<Integer> keys;

    protected BPlusTreeNode(NodeType nodeType) {
        this.nodeType = nodeType;
        this.keys = new ArrayList<>();
    }

    /**
     * 判断是否为叶子节点
     *
     * @return true 表示叶子节点
     */
    public boolean isLeaf() {
        return nodeType == NodeType.LEAF;
    }

    /**
     * 获取键的数量
     *
     * @return 键的数量
     */
    public int getKeyCount() {
        return keys.size();
    }

    /**
     * 获取指定索引的键
     *
     * @param index 索引
     * @return 键
     */
    public int getKey(int index) {
        if (index < 0 || index >= keys.size()) {
            throw new IndexOutOfBoundsException("Invalid key index: " + index);
        }
        return keys.get(index);
    }

    /**
     * 判断节点是否溢出
     * 键数量达到阶数时必须分裂
     *
     * @param order 树的阶数
     * @return true 表示需要分裂
     */
    public boolean isOverflow(int order) {
        return keys.size() >= order;
    }

    /**
     * 按叶子节点形态访问
     *
     * @return 叶子节点
     * @throws IllegalStateException 当前节点不是叶子节点
     */
    public LeafNode asLeaf() {
        if (nodeType != NodeType.LEAF) {
            throw new IllegalStateException("Expected leaf node but was " + nodeType);
        }
        return (LeafNode) this;
    }

    /**
     * 按内部节点形态访问
     *
     * @return 内部节点
     * @throws IllegalStateException 当前节点不是内部节点
     */
    public InternalNode asInternal() {
        if (nodeType != NodeType.INTERNAL) {
            throw new IllegalStateException("Expected internal node but was " + nodeType);
        }
        return (InternalNode) this;
    }

    /**
     * 分裂节点
     * 原节点保留左半部分，返回的结果中包含新建的右节点和需要上升到父节点的分隔键
     *
     * @return 分裂结果
     */
    public abstract SplitResult split();
}
