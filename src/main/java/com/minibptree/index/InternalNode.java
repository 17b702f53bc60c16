package com.minibptree.index;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * B+ 树内部节点（非叶子节点）
 *
 * 内部节点只负责导航：
 * - keys 有 n 个分隔键，children 有 n + 1 个子节点
 * - children[i] 子树中的键都满足 keys[i-1] <= key < keys[i]
 * - 分隔键等于右子树的最小键，所以查找时相等走右边
 *
 * @author Mini-BPTree
 */
@Getter
public class InternalNode extends BPlusTreeNode {

    /**
     * 子节点列表，长度 = keys.size() + 1
     */
    private final List<BPlusTreeNode> children;

    public InternalNode() {
        super(NodeType.INTERNAL);
        this.children = new ArrayList<>();
    }

    /**
     * 创建新的根节点：一个分隔键，两个子节点
     *
     * @param key   分隔键
     * @param left  左子节点
     * @param right 右子节点
     * @return 新根节点
     */
    public static InternalNode newRoot(int key, BPlusTreeNode left, BPlusTreeNode right) {
        InternalNode root = new InternalNode();
        root.keys.add(key);
        root.children.add(left);
        root.children.add(right);
        return root;
    }

    /**
     * 获取指定索引的子节点
     *
     * @param index 索引
     * @return 子节点
     */
    public BPlusTreeNode getChild(int index) {
        if (index < 0 || index >= children.size()) {
            throw new IndexOutOfBoundsException("Invalid child index: " + index);
        }
        return children.get(index);
    }

    /**
     * 获取子节点数量
     *
     * @return 子节点数量
     */
    public int getChildCount() {
        return children.size();
    }

    /**
     * 查找键应该进入的子节点位置
     * 从左到右扫描，key >= keys[i] 就继续往右
     *
     * @param key 键
     * @return 子节点索引
     */
    public int findChildIndex(int key) {
        int i = 0;
        while (i < keys.size() && key >= keys.get(i)) {
            i++;
        }
        return i;
    }

    /**
     * 按引用查找子节点的位置
     *
     * @param child 子节点
     * @return 子节点索引，不存在返回 -1
     */
    public int indexOfChild(BPlusTreeNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 在左子节点之后插入分隔键和右子节点
     *
     * @param key        分隔键
     * @param leftChild  已存在的左子节点
     * @param rightChild 新的右子节点
     * @return 是否插入成功（左子节点不在本节点中返回 false）
     */
    public boolean insertAfterChild(int key, BPlusTreeNode leftChild, BPlusTreeNode rightChild) {
        int index = indexOfChild(leftChild);
        if (index < 0) {
            return false;
        }
        keys.add(index, key);
        children.add(index + 1, rightChild);
        return true;
    }

    /**
     * 分裂内部节点
     *
     * 中间键 keys[mid] 上升到父节点，两边都不保留：
     * - 左节点（this）保留 [0, mid) 的键和 [0, mid] 的子节点
     * - 右节点包含 (mid, end) 的键和 (mid, end] 的子节点
     *
     * @return 分裂结果
     */
    @Override
    public SplitResult split() {
        int mid = keys.size() / 2;
        int upKey = keys.get(mid);
        InternalNode newNode = new InternalNode();

        newNode.keys.addAll(keys.subList(mid + 1, keys.size()));
        keys.subList(mid, keys.size()).clear();

        newNode.children.addAll(children.subList(mid + 1, children.size()));
        children.subList(mid + 1, children.size()).clear();

        return new SplitResult(upKey, this, newNode);
    }

    @Override
    public String toString() {
        return "InternalNode{keys=" + keys + ", children=" + children.size() + "}";
    }
}
