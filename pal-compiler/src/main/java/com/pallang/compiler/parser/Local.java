package com.pallang.compiler.parser;

/**
 * 局部变量记录；depth 为 -1 表示已声明但初始化表达式尚未编译完
 */
final class Local {

    static final int UNINITIALIZED = -1;

    final String name;
    int depth;

    Local(String name, int depth) {
        this.name = name;
        this.depth = depth;
    }

    boolean isInitialized() {
        return depth != UNINITIALIZED;
    }
}
