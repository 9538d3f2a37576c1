package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Token;

/**
 * 中缀规则：Token 延续一个表达式时调用
 */
public interface InfixRule {

    Precedence getPrecedence();

    /**
     * @param parser   编译器
     * @param operator 已消费的运算符 Token
     */
    void parse(Parser parser, Token operator);
}
