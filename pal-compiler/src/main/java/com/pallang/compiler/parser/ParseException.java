package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Token;

/**
 * 语法错误，在声明边界被捕获并转为 {@link CompileError}
 */
class ParseException extends RuntimeException {
    private final Token token;

    ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    Token getToken() {
        return token;
    }
}
