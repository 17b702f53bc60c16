package com.minibptree.index;

/**
 * 节点类型枚举
 *
 * B+ 树只有两种节点:
 * - LEAF: 叶子节点，存储键值对，并通过 next 指针串成链表
 * - INTERNAL: 内部节点，只存储分隔键和子节点引用
 *
 * @author Mini-BPTree
 */
public enum NodeType {
    /**
     * 叶子节点
     */
    LEAF,

    /**
     * 内部节点（非叶子节点）
     */
    INTERNAL
}
