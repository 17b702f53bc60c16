package com.minibptree.index;

import com.minibptree.common.Constants;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * B+ 树（BPlusTree）
 *
 * 内存中的有序索引，键和值都是 int，支持：
 * 1. 查找（Search）：从根走到叶子，O(log n)
 * 2. 插入（Insert）：键已存在则覆盖值，否则插入并在需要时分裂
 *
 * 插入的核心是分裂的级联传播：
 * 1. 叶子节点满（键数量达到阶数）时对半分裂，右节点的第一个键上升到父节点
 * 2. 父节点因此满了就继续分裂，中间键上升（两边都不保留）
 * 3. 一直传播到根节点时创建新根，树高度 +1
 *
 * 节点不保存父指针。插入时从根向下查找叶子，沿途经过的内部节点压入祖先栈，
 * 分裂向上传播时直接从栈里弹出父节点，不需要每一层都从根重新搜索。
 * {@link #findParent(BPlusTreeNode)} 保留了从根做深度优先搜索的方式，用于结构校验。
 *
 * 线程安全：本类不是线程安全的。并发使用时，调用方必须对每次 insert 加排他锁，
 * 查找之间可以并发，但不能和 insert 并发。
 *
 * 对应八股文知识点：
 * ✅ B+ 树的插入过程
 * ✅ B+ 树的查询过程
 * ✅ B+ 树的分裂（叶子分裂 vs 内部节点分裂）
 * ✅ B+ 树为什么是从下往上长高的
 *
 * @author Mini-BPTree
 */
@Slf4j
@Getter
public class BPlusTree {

    /**
     * 根节点，空树时为 null
     */
    private BPlusTreeNode root;

    /**
     * B+ 树的阶数（内部节点最多拥有的子节点数量）
     */
    private final int order;

    /**
     * 树的高度，空树为 0
     */
    private int height;

    /**
     * 树中的键值对数量
     */
    private int size;

    /**
     * 第一个叶子节点（叶子链表的头）
     * 分裂时左半部分留在原节点，所以最左叶子一旦创建就不会改变
     */
    private LeafNode firstLeaf;

    /**
     * 累计叶子分裂次数
     */
    private long leafSplits;

    /**
     * 累计内部节点分裂次数
     */
    private long internalSplits;

    /**
     * 累计根节点分裂次数（等于树长高的次数）
     */
    private long rootSplits;

    /**
     * 构造函数
     *
     * @param order B+ 树的阶数
     */
    public BPlusTree(int order) {
        if (order < Constants.MIN_ORDER) {
            throw new IllegalArgumentException("Order must be at least " + Constants.MIN_ORDER + ", got " + order);
        }
        this.order = order;
        this.height = Constants.EMPTY_TREE_HEIGHT;
    }

    /**
     * 默认构造函数
     * 使用默认阶数 4
     */
    public BPlusTree() {
        this(Constants.DEFAULT_ORDER);
    }

    /**
     * 查找键对应的值
     *
     * @param key 要查找的键
     * @return 对应的值，不存在返回 empty
     */
    public OptionalInt search(int key) {
        LeafNode leaf = findLeaf(key);
        if (leaf == null) {
            return OptionalInt.empty();
        }

        int index = leaf.findKeyIndex(key);
        if (index < 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(leaf.getValue(index));
    }

    /**
     * 插入键值对
     * 键已存在时覆盖值，树结构不变
     *
     * @param key   键
     * @param value 值
     */
    public void insert(int key, int value) {
        // 空树：创建第一个叶子节点作为根
        if (root == null) {
            LeafNode leaf = new LeafNode();
            leaf.insertSorted(key, value);
            root = leaf;
            firstLeaf = leaf;
            height = 1;
            size = 1;
            log.debug("Created root leaf, key={}, value={}", key, value);
            return;
        }

        Deque<InternalNode> ancestors = new ArrayDeque<>();
        LeafNode leaf = findLeaf(key, ancestors);

        int index = leaf.findKeyIndex(key);
        if (index >= 0) {
            leaf.setValue(index, value);
            log.debug("Updated key={}, value={}", key, value);
            return;
        }

        leaf.insertSorted(key, value);
        size++;

        // 如果叶子节点已满，需要分裂
        if (leaf.isOverflow(order)) {
            splitLeafNode(leaf, ancestors);
        }

        log.debug("Inserted key={}, value={}, size={}", key, value, size);
    }

    /**
     * 判断树是否为空
     *
     * @return true 表示空树
     */
    public boolean isEmpty() {
        return root == null;
    }

    /**
     * 清空树
     */
    public void clear() {
        this.root = null;
        this.firstLeaf = null;
        this.height = Constants.EMPTY_TREE_HEIGHT;
        this.size = 0;
        this.leafSplits = 0;
        this.internalSplits = 0;
        this.rootSplits = 0;
        log.debug("Tree cleared");
    }

    /**
     * 查找键所属的叶子节点
     *
     * @param key 键
     * @return 叶子节点，空树返回 null
     */
    LeafNode findLeaf(int key) {
        return findLeaf(key, null);
    }

    /**
     * 查找键所属的叶子节点，并记录沿途经过的内部节点
     *
     * @param key       键
     * @param ancestors 祖先栈，栈顶是叶子的父节点；为 null 时不记录
     * @return 叶子节点，空树返回 null
     */
    private LeafNode findLeaf(int key, Deque<InternalNode> ancestors) {
        BPlusTreeNode node = root;
        if (node == null) {
            return null;
        }

        while (!node.isLeaf()) {
            InternalNode internal = node.asInternal();
            if (ancestors != null) {
                ancestors.push(internal);
            }
            // 相等走右边：分隔键就是右子树的最小键
            node = internal.getChild(internal.findChildIndex(key));
        }

        return node.asLeaf();
    }

    /**
     * 分裂叶子节点
     *
     * @param leaf      要分裂的叶子节点
     * @param ancestors 祖先栈
     */
    private void splitLeafNode(LeafNode leaf, Deque<InternalNode> ancestors) {
        SplitResult result = leaf.split();
        leafSplits++;
        log.debug("Split leaf, promotedKey={}, left={}, right={}",
                result.getPromotedKey(), result.getLeft(), result.getRight());
        promote(result, ancestors);
    }

    /**
     * 分裂内部节点
     *
     * @param node      要分裂的内部节点
     * @param ancestors 剩余的祖先栈
     */
    private void splitInternalNode(InternalNode node, Deque<InternalNode> ancestors) {
        SplitResult result = node.split();
        internalSplits++;
        log.debug("Split internal node, promotedKey={}, left={}, right={}",
                result.getPromotedKey(), result.getLeft(), result.getRight());
        promote(result, ancestors);
    }

    /**
     * 将分裂产生的分隔键和右节点插入父节点
     *
     * @param result    分裂结果
     * @param ancestors 祖先栈，栈顶是 result.left 的父节点
     */
    private void promote(SplitResult result, Deque<InternalNode> ancestors) {
        BPlusTreeNode left = result.getLeft();

        // 如果是根节点，创建新根
        if (left == root) {
            root = InternalNode.newRoot(result.getPromotedKey(), left, result.getRight());
            height++;
            rootSplits++;
            log.debug("Created new root, key={}, height={}", result.getPromotedKey(), height);
            return;
        }

        InternalNode parent = ancestors.poll();
        if (parent == null) {
            throw structureViolation("No parent found for non-root node " + left);
        }
        if (!parent.insertAfterChild(result.getPromotedKey(), left, result.getRight())) {
            throw structureViolation("Node " + left + " is not a child of " + parent);
        }

        // 如果父节点也满了，递归分裂
        if (parent.isOverflow(order)) {
            splitInternalNode(parent, ancestors);
        }
    }

    /**
     * 从根节点开始深度优先搜索，找到直接持有 child 的内部节点
     *
     * @param child 子节点
     * @return 父节点；child 是根节点或不在树中时返回 empty
     */
    public Optional<InternalNode> findParent(BPlusTreeNode child) {
        if (root == null || root.isLeaf() || child == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(findParent(root.asInternal(), child));
    }

    private InternalNode findParent(InternalNode current, BPlusTreeNode child) {
        for (BPlusTreeNode candidate : current.getChildren()) {
            if (candidate == child) {
                return current;
            }
            if (!candidate.isLeaf()) {
                InternalNode found = findParent(candidate.asInternal(), child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * 收集树的统计信息
     *
     * @return 统计信息快照
     */
    public TreeStatistics collectStatistics() {
        TreeStatistics stats = new TreeStatistics();
        stats.setOrder(order);
        stats.setSize(size);
        stats.setHeight(height);
        stats.setLeafSplits(leafSplits);
        stats.setInternalSplits(internalSplits);
        stats.setRootSplits(rootSplits);
        if (root != null) {
            countNodes(root, stats);
        }
        return stats;
    }

    private void countNodes(BPlusTreeNode node, TreeStatistics stats) {
        switch (node.getNodeType()) {
            case LEAF:
                stats.setLeafCount(stats.getLeafCount() + 1);
                break;
            case INTERNAL:
                stats.setInternalCount(stats.getInternalCount() + 1);
                for (BPlusTreeNode child : node.asInternal().getChildren()) {
                    countNodes(child, stats);
                }
                break;
            default:
                throw new IllegalStateException("Unknown node type: " + node.getNodeType());
        }
    }

    /**
     * 输出树结构（单行）
     * 叶子节点: [1, 2]
     * 内部节点: Internal[3](..., ...)
     *
     * @return 树结构字符串
     */
    public String toTreeString() {
        if (root == null) {
            return "<empty>";
        }
        StringBuilder sb = new StringBuilder();
        appendNode(root, sb);
        return sb.toString();
    }

    private void appendNode(BPlusTreeNode node, StringBuilder sb) {
        switch (node.getNodeType()) {
            case LEAF:
                sb.append(node.getKeys());
                break;
            case INTERNAL:
                InternalNode internal = node.asInternal();
                sb.append("Internal").append(internal.getKeys()).append('(');
                for (int i = 0; i < internal.getChildCount(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    appendNode(internal.getChild(i), sb);
                }
                sb.append(')');
                break;
            default:
                throw new IllegalStateException("Unknown node type: " + node.getNodeType());
        }
    }

    private TreeStructureException structureViolation(String message) {
        log.error("B+ tree structure violated: {}", message);
        return new TreeStructureException(message);
    }

    /**
     * 树结构不变量被破坏
     * 属于程序错误，树已经处于不一致状态，不应该被捕获后继续使用
     */
    public static class TreeStructureException extends IllegalStateException {
        public TreeStructureException(String message) {
            super(message);
        }
    }
}
