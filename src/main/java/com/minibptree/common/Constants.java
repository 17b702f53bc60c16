package com.minibptree.common;

/**
 * 系统常量定义
 *
 * @author Mini-BPTree
 */
public class Constants {

    // ==================== B+ 树相关常量 ====================

    /**
     * B+ 树默认阶数：4
     * 阶数 = 内部节点最多拥有的子节点数量
     * 稳定状态下每个节点最多存储 order - 1 个键
     *
     * 为什么这么小？
     * 1. 少量插入就会触发分裂，便于观察多层分裂传播
     * 2. 测试用例可以精确断言树的形状
     */
    public static final int DEFAULT_ORDER = 4;

    /**
     * B+ 树最小阶数：3
     * 阶数小于 3 时分裂后的节点可能为空，分裂没有意义
     */
    public static final int MIN_ORDER = 3;

    /**
     * 空树的高度
     */
    public static final int EMPTY_TREE_HEIGHT = 0;

    // ==================== 私有构造函数 ====================

    private Constants() {
        // 工具类，禁止实例化
    }
}
