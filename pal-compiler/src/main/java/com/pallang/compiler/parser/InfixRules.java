package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Token;
import com.pallang.compiler.lexer.TokenType;
import pal.runtime.bytecode.OpCode;

/**
 * 中缀规则实现
 */
final class InfixRules {

    private InfixRules() {
    }

    /**
     * 左结合二元运算；可以生成多条指令（如 {@code !=} 为 EQUAL INVERT）
     */
    static final class Binary implements InfixRule {
        private final Precedence precedence;
        private final OpCode[] ops;

        Binary(Precedence precedence, OpCode... ops) {
            this.precedence = precedence;
            this.ops = ops;
        }

        @Override
        public Precedence getPrecedence() {
            return precedence;
        }

        @Override
        public void parse(Parser parser, Token operator) {
            parser.parsePrecedence(precedence);
            for (OpCode op : ops) {
                parser.emit(op);
            }
        }
    }

    /**
     * 后缀打印 {@code ?}：打印栈顶但不弹出
     */
    static final class Print implements InfixRule {
        @Override
        public Precedence getPrecedence() {
            return Precedence.PREFIX;
        }

        @Override
        public void parse(Parser parser, Token operator) {
            parser.emit(OpCode.PRINT);
        }
    }

    /**
     * 调用：逗号分隔的参数列表
     */
    static final class Call implements InfixRule {
        @Override
        public Precedence getPrecedence() {
            return Precedence.CALL;
        }

        @Override
        public void parse(Parser parser, Token operator) {
            int argCount = 0;
            parser.skipNewlines();
            if (!parser.check(TokenType.RPAREN)) {
                do {
                    parser.skipNewlines();
                    parser.expression();
                    if (argCount == Parser.MAX_ARGUMENTS) {
                        throw parser.errorAtPrevious("Can't have more than " + Parser.MAX_ARGUMENTS + " arguments");
                    }
                    argCount++;
                    parser.skipNewlines();
                } while (parser.match(TokenType.COMMA));
            }
            parser.consume(TokenType.RPAREN, "Expected ')' after arguments");
            parser.emit(OpCode.CALL, argCount);
        }
    }

    /**
     * 成员读取 {@code a.b}
     */
    static final class Field implements InfixRule {
        @Override
        public Precedence getPrecedence() {
            return Precedence.CALL;
        }

        @Override
        public void parse(Parser parser, Token operator) {
            Token name = parser.consume(TokenType.IDENTIFIER, "Expected property name after '.'");
            parser.emit(OpCode.GET_FIELD, parser.identifierConstant(name.getLexeme()));
        }
    }
}
