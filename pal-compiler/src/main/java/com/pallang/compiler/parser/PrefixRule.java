package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Token;

/**
 * 前缀规则：Token 出现在表达式开头时调用
 */
@FunctionalInterface
public interface PrefixRule {

    /**
     * @param parser    编译器
     * @param token     已消费的起始 Token
     * @param canAssign 当前位置是否允许赋值
     */
    void parse(Parser parser, Token token, boolean canAssign);
}
