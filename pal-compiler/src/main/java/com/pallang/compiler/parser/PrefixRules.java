package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Keyword;
import com.pallang.compiler.lexer.Token;
import com.pallang.compiler.lexer.TokenType;
import pal.runtime.PalAlgorithm;
import pal.runtime.PalCorrection;
import pal.runtime.PalNumber;
import pal.runtime.PalPath;
import pal.runtime.PalString;
import pal.runtime.bytecode.OpCode;

/**
 * 前缀规则实现
 */
final class PrefixRules {

    private PrefixRules() {
    }

    /** 十进制、十六进制、二进制数 */
    static void number(Parser parser, Token token, boolean canAssign) {
        parser.emitConstant(PalNumber.of((Double) token.getLiteral()));
    }

    static void string(Parser parser, Token token, boolean canAssign) {
        parser.emitConstant(PalString.of((String) token.getLiteral()));
    }

    static void path(Parser parser, Token token, boolean canAssign) {
        parser.emitConstant(PalPath.of((String) token.getLiteral()));
    }

    static void variable(Parser parser, Token token, boolean canAssign) {
        parser.namedVariable(token, canAssign);
    }

    /** 一元 - 与 ! */
    static void unary(Parser parser, Token token, boolean canAssign) {
        parser.parsePrecedence(Precedence.PREFIX);
        parser.emit(token.is(TokenType.MINUS) ? OpCode.NEGATE : OpCode.INVERT);
    }

    static void grouping(Parser parser, Token token, boolean canAssign) {
        parser.expression();
        parser.consume(TokenType.RPAREN, "Expected ')' to end grouping");
    }

    /**
     * 数组字面量：先创建空数组，再逐个追加元素
     */
    static void array(Parser parser, Token token, boolean canAssign) {
        parser.emit(OpCode.ARRAY);
        parser.skipNewlines();
        if (!parser.check(TokenType.RBRACKET)) {
            do {
                parser.skipNewlines();
                parser.expression();
                parser.emit(OpCode.DEF_ELEM);
                parser.skipNewlines();
            } while (parser.match(TokenType.COMMA));
        }
        parser.consume(TokenType.RBRACKET, "Expected ']' to end array");
    }

    /** true / false / void */
    static void literal(Parser parser, Token token, boolean canAssign) {
        Keyword keyword = token.getKeyword();
        if (keyword == Keyword.TRUE) {
            parser.emit(OpCode.TRUE);
        } else if (keyword == Keyword.FALSE) {
            parser.emit(OpCode.FALSE);
        } else {
            parser.emit(OpCode.NULL);
        }
    }

    static void correction(Parser parser, Token token, boolean canAssign) {
        parser.emitConstant(PalCorrection.of(token.getLexeme()));
    }

    static void algorithm(Parser parser, Token token, boolean canAssign) {
        parser.emitConstant(PalAlgorithm.of(token.getLexeme()));
    }
}
