package com.minibptree.index;

import com.minibptree.index.BPlusTree.TreeStructureException;

import java.util.ArrayList;
import java.util.List;

/**
 * B+ 树结构校验器
 *
 * 检查一棵树是否满足全部结构不变量，发现第一个问题就抛出 {@link TreeStructureException}：
 * 1. 阶数约束：每个节点最多 order - 1 个键
 * 2. 有序性：节点内的键严格递增，叶子的键值数量一致
 * 3. 内部节点：子节点数量 = 键数量 + 1，且至少有一个键
 * 4. 分隔键：children[i] 子树中的键都在 [keys[i-1], keys[i]) 内
 * 5. 平衡：所有叶子在同一深度，且等于树高
 * 6. 父子关系：每个非根节点都能通过 findParent 找到唯一的父节点
 * 7. 叶子链表：从第一个叶子沿 next 走完所有叶子，键严格递增，总数等于 size
 *
 * @author Mini-BPTree
 */
public class BPlusTreeValidator {

    private final BPlusTree tree;

    /**
     * 按从左到右的顺序收集到的叶子节点
     */
    private final List<LeafNode> leaves = new ArrayList<>();

    private BPlusTreeValidator(BPlusTree tree) {
        this.tree = tree;
    }

    /**
     * 校验整棵树
     *
     * @param tree 要校验的树
     * @throws TreeStructureException 任一不变量被破坏
     */
    public static void validate(BPlusTree tree) {
        new BPlusTreeValidator(tree).run();
    }

    private void run() {
        BPlusTreeNode root = tree.getRoot();
        if (root == null) {
            check(tree.getSize() == 0, "Empty tree has size " + tree.getSize());
            check(tree.getHeight() == 0, "Empty tree has height " + tree.getHeight());
            check(tree.getFirstLeaf() == null, "Empty tree has a first leaf");
            return;
        }

        check(!tree.findParent(root).isPresent(), "Root node has a parent");
        checkNode(root, 1, null, null);
        checkLeafChain();
    }

    /**
     * 递归校验子树
     *
     * @param node  当前节点
     * @param depth 当前深度（根为 1）
     * @param lower 下界（包含），null 表示无下界
     * @param upper 上界（不包含），null 表示无上界
     */
    private void checkNode(BPlusTreeNode node, int depth, Integer lower, Integer upper) {
        List<Integer> keys = node.getKeys();

        check(keys.size() <= tree.getOrder() - 1,
                "Node " + node + " holds " + keys.size() + " keys, order is " + tree.getOrder());

        for (int i = 0; i < keys.size(); i++) {
            int key = keys.get(i);
            if (i > 0) {
                check(keys.get(i - 1) < key, "Keys not strictly ascending in " + node);
            }
            check(lower == null || key >= lower, "Key " + key + " below separator " + lower + " in " + node);
            check(upper == null || key < upper, "Key " + key + " not below separator " + upper + " in " + node);
        }

        switch (node.getNodeType()) {
            case LEAF:
                LeafNode leaf = node.asLeaf();
                check(leaf.getValues().size() == keys.size(), "Key/value count mismatch in " + leaf);
                check(depth == tree.getHeight(),
                        "Leaf " + leaf + " at depth " + depth + ", tree height is " + tree.getHeight());
                leaves.add(leaf);
                break;
            case INTERNAL:
                InternalNode internal = node.asInternal();
                check(!keys.isEmpty(), "Internal node without keys");
                check(internal.getChildCount() == keys.size() + 1,
                        "Internal node " + internal + " has " + internal.getChildCount()
                                + " children for " + keys.size() + " keys");
                for (int i = 0; i < internal.getChildCount(); i++) {
                    BPlusTreeNode child = internal.getChild(i);
                    check(tree.findParent(child).orElse(null) == internal,
                            "Parent lookup mismatch for " + child);
                    Integer childLower = i == 0 ? lower : keys.get(i - 1);
                    Integer childUpper = i == keys.size() ? upper : keys.get(i);
                    checkNode(child, depth + 1, childLower, childUpper);
                }
                break;
            default:
                throw new TreeStructureException("Unknown node type: " + node.getNodeType());
        }
    }

    /**
     * 沿 next 指针遍历叶子链表，必须和从左到右遍历得到的叶子完全一致
     */
    private void checkLeafChain() {
        check(tree.getFirstLeaf() == leaves.get(0), "First leaf is not the leftmost leaf");

        LeafNode current = tree.getFirstLeaf();
        int visited = 0;
        int entries = 0;
        Integer previousKey = null;

        while (current != null) {
            check(visited < leaves.size(), "Leaf chain is longer than the number of leaves");
            check(current == leaves.get(visited), "Leaf chain out of order at position " + visited);

            for (int key : current.getKeys()) {
                check(previousKey == null || previousKey < key,
                        "Leaf chain keys not ascending: " + previousKey + " then " + key);
                previousKey = key;
                entries++;
            }
            visited++;
            current = current.getNext();
        }

        check(visited == leaves.size(), "Leaf chain visits " + visited + " of " + leaves.size() + " leaves");
        check(entries == tree.getSize(), "Leaf chain holds " + entries + " entries, size is " + tree.getSize());
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new TreeStructureException(message);
        }
    }
}
