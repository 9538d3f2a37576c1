package com.pallang.compiler.parser;

/**
 * 正在编译的函数种类
 */
public enum FunctionKind {
    SCRIPT,
    FUNCTION,
    GENERATOR
}
