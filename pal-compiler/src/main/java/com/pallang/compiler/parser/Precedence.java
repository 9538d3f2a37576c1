package com.pallang.compiler.parser;

/**
 * 运算优先级（由低到高）
 */
public enum Precedence {
    NONE,
    DECLARATION,
    STATEMENT,
    ASSIGN,       // =
    COMPARISON,   // == != < > <= >=
    TERM,         // + - |
    EXPONENT,     // ^
    PREFIX,       // - ! 以及后缀打印 ?
    CALL;         // () .

    /**
     * 高一级的优先级，用于左结合二元运算的右操作数
     */
    public Precedence next() {
        Precedence[] values = values();
        return values[Math.min(ordinal() + 1, values.length - 1)];
    }

    public boolean allowsAssignment() {
        return compareTo(ASSIGN) <= 0;
    }
}
