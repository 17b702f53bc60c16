package com.minibptree.index;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * B+ 树叶子节点
 *
 * 叶子节点的特点：
 * 1. 存储实际的键值对，keys[i] 对应 values[i]
 * 2. 键严格递增，不允许重复
 * 3. 通过 next 指针按键顺序连接成单向链表
 *
 * next 只是结构上的链接，不表示所有权：叶子节点只属于它的父节点。
 *
 * @author Mini-BPTree
 */
@Getter
public class LeafNode extends BPlusTreeNode {

    /**
     * 值列表，与 keys 一一对应
     */
    private final List<Integer> values;

    /**
     * 下一个叶子节点（按键顺序）
     */
    private LeafNode next;

    public LeafNode() {
        super(NodeType.LEAF);
        this.values = new ArrayList<>();
    }

    /**
     * 在叶子节点中查找键的位置（线性扫描）
     *
     * @param key 要查找的键
     * @return 键的索引，不存在返回 -1
     */
    public int findKeyIndex(int key) {
        for (int i = 0; i < keys.size(); i++) {
            if (keys.get(i) == key) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 获取指定索引的值
     *
     * @param index 索引
     * @return 值
     */
    public int getValue(int index) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException("Invalid value index: " + index);
        }
        return values.get(index);
    }

    /**
     * 覆盖指定索引的值
     *
     * @param index 索引
     * @param value 新值
     */
    public void setValue(int index, int value) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException("Invalid value index: " + index);
        }
        values.set(index, value);
    }

    /**
     * 插入一个新的键值对（调用方保证键不存在）
     *
     * 插入过程相当于插入排序的一步：
     * 1. 追加到末尾
     * 2. 从末尾开始和前一个元素比较，逆序则交换
     * 3. 遇到第一对有序的相邻元素就停止（插入前本身有序）
     *
     * @param key   键
     * @param value 值
     * @return 最终插入位置
     */
    public int insertSorted(int key, int value) {
        keys.add(key);
        values.add(value);

        int i = keys.size() - 1;
        while (i > 0 && keys.get(i) < keys.get(i - 1)) {
            swap(keys, i, i - 1);
            swap(values, i, i - 1);
            i--;
        }
        return i;
    }

    /**
     * 分裂叶子节点
     *
     * 右节点包含 [mid, count) 的键值对，左节点（this）保留 [0, mid)。
     * 新节点插入到链表中 this 的后面，分隔键是右节点的第一个键（右节点也保留这个键）。
     *
     * @return 分裂结果
     */
    @Override
    public SplitResult split() {
        int mid = keys.size() / 2;
        LeafNode newLeaf = new LeafNode();

        newLeaf.keys.addAll(keys.subList(mid, keys.size()));
        newLeaf.values.addAll(values.subList(mid, values.size()));

        keys.subList(mid, keys.size()).clear();
        values.subList(mid, values.size()).clear();

        // 维护叶子节点链表
        newLeaf.next = this.next;
        this.next = newLeaf;

        return new SplitResult(newLeaf.keys.get(0), this, newLeaf);
    }

    private static void swap(List<Integer> list, int i, int j) {
        Integer tmp = list.get(i);
        list.set(i, list.get(j));
        list.set(j, tmp);
    }

    @Override
    public String toString() {
        return "LeafNode{keys=" + keys + ", values=" + values + "}";
    }
}
