package com.minibptree.index;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * B+ 树的场景测试
 *
 * 每次插入后都做完整的结构校验，并和 TreeMap 的结果对比：
 * 1. 固定的插入序列和期望的树形状
 * 2. 顺序、逆序、随机插入
 * 3. 树高每次最多增长 1，并且只在根节点分裂时增长
 *
 * @author Mini-BPTree
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class BPlusTreeScenarioTest {

    private BPlusTree tree;

    @BeforeEach
    void setUp() {
        tree = new BPlusTree(4);
    }

    /**
     * 插入并检查不变量：结构合法，树高最多增长 1 且只在根分裂时增长
     */
    private void insertChecked(int key, int value) {
        int heightBefore = tree.getHeight();
        long rootSplitsBefore = tree.getRootSplits();
        BPlusTreeNode rootBefore = tree.getRoot();

        tree.insert(key, value);

        BPlusTreeValidator.validate(tree);
        int growth = tree.getHeight() - heightBefore;
        assertTrue(growth == 0 || growth == 1, "Height grew by " + growth);
        if (rootBefore == null) {
            assertEquals(1, tree.getHeight());
        } else if (growth == 1) {
            assertEquals(rootSplitsBefore + 1, tree.getRootSplits());
            assertNotSame(rootBefore, tree.getRoot());
        } else {
            assertEquals(rootSplitsBefore, tree.getRootSplits());
            assertSame(rootBefore, tree.getRoot());
        }
    }

    /**
     * 沿叶子链表收集所有键
     */
    private List<Integer> chainKeys() {
        List<Integer> keys = new ArrayList<>();
        for (LeafNode leaf = tree.getFirstLeaf(); leaf != null; leaf = leaf.getNext()) {
            keys.addAll(leaf.getKeys());
        }
        return keys;
    }

    /**
     * 场景 1：空树插入一个键
     */
    @Test
    @Order(1)
    void testFirstInsertCreatesLeafRoot() {
        insertChecked(10, 100);

        assertTrue(tree.getRoot().isLeaf());
        assertEquals("[10]", tree.toTreeString());
        assertEquals(100, tree.search(10).getAsInt());
    }

    /**
     * 场景 2：第 4 个键触发叶子分裂
     */
    @Test
    @Order(2)
    void testFourthInsertSplitsLeaf() {
        for (int key : new int[]{10, 20, 5, 6}) {
            insertChecked(key, key * 10);
        }

        assertEquals("Internal[10]([5, 6], [10, 20])", tree.toTreeString());
        assertEquals(60, tree.search(6).getAsInt());
        assertFalse(tree.search(15).isPresent());
    }

    /**
     * 场景 3：继续插入 15, 25, 2, 16, 18
     * 叶子分裂两次，根节点积累到 3 个分隔键，但还没有溢出
     */
    @Test
    @Order(3)
    void testCascadingLeafSplits() {
        for (int key : new int[]{10, 20, 5, 6, 15, 25, 2, 16, 18}) {
            insertChecked(key, key * 10);
        }

        assertEquals("Internal[10, 16, 20]([2, 5, 6], [10, 15], [16, 18], [20, 25])", tree.toTreeString());
        assertEquals(2, tree.getHeight());
        assertEquals(3, tree.getLeafSplits());
        assertEquals(0, tree.getInternalSplits());
        assertEquals(180, tree.search(18).getAsInt());
        assertFalse(tree.search(30).isPresent());

        // 17 落入 [16, 18]，不分裂
        insertChecked(17, 170);
        assertEquals(2, tree.getHeight());

        // 3 使 [2, 5, 6] 分裂，根节点随之溢出，树长到 3 层
        insertChecked(3, 30);
        assertEquals(3, tree.getHeight());
        assertEquals(1, tree.getInternalSplits());
        assertEquals("Internal[16](Internal[5, 10]([2, 3], [5, 6], [10, 15]), Internal[20]([16, 17, 18], [20, 25]))",
                tree.toTreeString());
    }

    /**
     * 场景 4：重复插入同一个键只更新值
     */
    @Test
    @Order(4)
    void testDuplicateInsertUpdatesValue() {
        insertChecked(10, 100);
        insertChecked(10, 999);

        assertEquals(999, tree.search(10).getAsInt());
        assertEquals(1, tree.getSize());
        assertEquals(Collections.singletonList(10), chainKeys());
    }

    /**
     * 场景 5：顺序插入 1..20
     */
    @Test
    @Order(5)
    void testAscendingInserts() {
        int previousHeight = 0;
        for (int key = 1; key <= 20; key++) {
            insertChecked(key, key);
            assertTrue(tree.getHeight() >= previousHeight);
            previousHeight = tree.getHeight();
        }

        assertEquals(3, tree.getHeight());
        assertEquals("Internal[7, 13](Internal[3, 5]([1, 2], [3, 4], [5, 6]), "
                        + "Internal[9, 11]([7, 8], [9, 10], [11, 12]), "
                        + "Internal[15, 17, 19]([13, 14], [15, 16], [17, 18], [19, 20]))",
                tree.toTreeString());
    }

    /**
     * 测试逆序插入 20..1
     */
    @Test
    @Order(6)
    void testDescendingInserts() {
        for (int key = 20; key >= 1; key--) {
            insertChecked(key, key);
        }

        assertEquals("Internal[9, 13, 17](Internal[3, 5, 7]([1, 2], [3, 4], [5, 6], [7, 8]), "
                        + "Internal[11]([9, 10], [11, 12]), "
                        + "Internal[15]([13, 14], [15, 16]), "
                        + "Internal[19]([17, 18], [19, 20]))",
                tree.toTreeString());
        for (int key = 1; key <= 20; key++) {
            assertEquals(key, tree.search(key).getAsInt());
        }
    }

    /**
     * 测试随机插入（包含重复键），结果与 TreeMap 一致
     */
    @Test
    @Order(7)
    void testRandomInsertsMatchTreeMap() {
        Random random = new Random(42);
        Map<Integer, Integer> expected = new TreeMap<>();

        for (int i = 0; i < 2000; i++) {
            int key = random.nextInt(500) - 250;
            int value = random.nextInt();
            insertChecked(key, value);
            expected.put(key, value);
        }

        assertEquals(expected.size(), tree.getSize());
        assertEquals(new ArrayList<>(expected.keySet()), chainKeys());
        for (int key = -260; key < 260; key++) {
            Integer value = expected.get(key);
            if (value == null) {
                assertFalse(tree.search(key).isPresent(), "key " + key);
            } else {
                assertEquals(value.intValue(), tree.search(key).getAsInt(), "key " + key);
            }
        }
    }

    /**
     * 测试不同阶数下的随机插入
     */
    @Test
    @Order(8)
    void testRandomInsertsAcrossOrders() {
        for (int order = 3; order <= 8; order++) {
            tree = new BPlusTree(order);
            Random random = new Random(order);
            List<Integer> keys = new ArrayList<>();
            for (int i = 0; i < 300; i++) {
                keys.add(i);
            }
            Collections.shuffle(keys, random);

            for (int key : keys) {
                insertChecked(key, key * 7);
            }

            assertEquals(300, tree.getSize(), "order " + order);
            for (int key = 0; key < 300; key++) {
                assertEquals(key * 7, tree.search(key).getAsInt(), "order " + order);
            }
        }
    }
}
