package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Token;
import com.pallang.compiler.lexer.TokenType;

/**
 * 编译中收集的语法错误
 */
public final class CompileError {
    private final String message;
    private final Token token;

    public CompileError(String message, Token token) {
        this.message = message;
        this.token = token;
    }

    public String getMessage() {
        return message;
    }

    public Token getToken() {
        return token;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    /**
     * 错误出现在输入末尾
     */
    public boolean isAtEnd() {
        return token != null && token.is(TokenType.EOF);
    }

    /**
     * 面向用户的格式：{@code Syntax Error: <msg> at <line>:<column>}
     */
    public String format() {
        String where = isAtEnd() ? "end" : getLine() + ":" + getColumn();
        return "Syntax Error: " + message + " at " + where;
    }

    @Override
    public String toString() {
        return format();
    }
}
