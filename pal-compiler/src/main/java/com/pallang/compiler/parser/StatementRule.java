package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Token;

/**
 * 语句规则：以关键词开头的语句
 */
@FunctionalInterface
public interface StatementRule {

    /**
     * @param parser  编译器
     * @param keyword 已消费的关键词 Token
     */
    void parse(Parser parser, Token keyword);
}
