package com.minibptree.demo;

import com.minibptree.index.BPlusTree;
import com.minibptree.index.BPlusTreeValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.OptionalInt;

/**
 * B+ 树演示程序
 *
 * 插入 9 个键值对，再查找 10 个键（其中 30 不存在），逐行打印结果：
 * <pre>
 * Key 2 =&gt; 20
 * ...
 * Key 30 not found.
 * </pre>
 *
 * @author Mini-BPTree
 */
@Slf4j
public class BPlusTreeDemo {

    static final int[][] ENTRIES = {
            {10, 100}, {20, 200}, {5, 50}, {6, 60}, {15, 150},
            {25, 250}, {2, 20}, {16, 160}, {18, 180}
    };

    static final int[] LOOKUPS = {2, 5, 6, 10, 15, 16, 18, 20, 25, 30};

    public static void main(String[] args) {
        run(new BPlusTree(), System.out);
    }

    /**
     * 执行演示
     *
     * @param tree 空树
     * @param out  输出流
     */
    static void run(BPlusTree tree, PrintStream out) {
        // 插入测试
        for (int[] entry : ENTRIES) {
            tree.insert(entry[0], entry[1]);
        }
        BPlusTreeValidator.validate(tree);
        log.info("Tree after {} inserts: {}", ENTRIES.length, tree.toTreeString());

        // 检索测试
        for (int key : LOOKUPS) {
            OptionalInt result = tree.search(key);
            if (result.isPresent()) {
                out.println("Key " + key + " => " + result.getAsInt());
            } else {
                out.println("Key " + key + " not found.");
            }
        }
    }
}
