package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Keyword;
import com.pallang.compiler.lexer.Token;
import pal.runtime.PalValue;
import pal.runtime.bytecode.OpCode;

import java.util.HashSet;
import java.util.Set;

import static com.pallang.compiler.lexer.TokenType.*;

/**
 * 关键词语句规则实现
 */
final class StatementRules {

    private StatementRules() {
    }

    /**
     * {@code var name = expr}：初始化表达式编译完之后才定义变量
     */
    static void var(Parser parser, Token keyword) {
        int global = parser.parseVariable("Expected variable name");
        parser.consume(ASSIGN, "Expected '=' after variable name");
        parser.expression();
        parser.defineVariable(global);
    }

    static void function(Parser parser, Token keyword) {
        callable(parser, keyword, FunctionKind.FUNCTION);
    }

    static void generator(Parser parser, Token keyword) {
        callable(parser, keyword, FunctionKind.GENERATOR);
    }

    /**
     * 函数与生成器声明，只允许出现在顶层脚本中
     */
    private static void callable(Parser parser, Token keyword, FunctionKind kind) {
        boolean generator = kind == FunctionKind.GENERATOR;
        if (parser.getScope().getKind() != FunctionKind.SCRIPT) {
            ParseException error = parser.error(keyword, generator
                    ? "Generator nesting is not supported"
                    : "Function nesting is not supported");
            parser.skipRejectedBlock();
            throw error;
        }
        int global = parser.parseVariable(generator ? "Expected generator name" : "Expected function name");
        Token name = parser.previous;
        parser.markInitialized();

        parser.beginFunction(kind, name.getLexeme());
        parser.consume(LPAREN, "Expected '(' to start parameter definition");
        if (!parser.check(RPAREN)) {
            do {
                if (parser.getScope().getArity() == Parser.MAX_ARGUMENTS) {
                    throw parser.errorAtCurrent("Can't have more than " + Parser.MAX_ARGUMENTS + " parameters");
                }
                parser.getScope().addParameter();
                int parameter = parser.parseVariable("Expected parameter name");
                parser.defineVariable(parameter);
            } while (parser.match(COMMA));
        }
        parser.consume(RPAREN, "Expected ')' after parameters");
        parser.consume(LBRACE, generator ? "Expected '{' to begin generator block" : "Expected '{' to begin function block");
        parser.block();

        PalValue compiled = parser.endFunction();
        parser.emitConstant(compiled);
        parser.defineVariable(global);
    }

    /**
     * {@code for (var i = init, cond, incr) { body }}
     *
     * <p>递增子句先于循环体编译，首次进入时跳过它；循环体末尾跳回递增子句，
     * 递增子句再跳回条件。</p>
     */
    static void forLoop(Parser parser, Token keyword) {
        parser.beginScope();
        parser.consume(LPAREN, "Expected '(' after 'for'");
        parser.consume(Keyword.VAR, "Expected 'var' to declare the loop variable");
        int global = parser.parseVariable("Expected loop variable name");
        parser.consume(ASSIGN, "Expected '=' after loop variable");
        parser.expression();
        parser.defineVariable(global);
        parser.consume(COMMA, "Expected ',' after loop initializer");

        int loopStart = parser.currentChunk().size();
        parser.expression();
        parser.consume(COMMA, "Expected ',' after loop condition");
        int exitJump = parser.emitJump(OpCode.FALSEY_JUMP);
        parser.emit(OpCode.POP);

        int bodyJump = parser.emitJump(OpCode.ALWAYS_JUMP);
        int incrementStart = parser.currentChunk().size();
        parser.expression();
        parser.emit(OpCode.POP);
        parser.consume(RPAREN, "Expected ')' after loop clauses");
        parser.emitLoop(loopStart);
        parser.patchJump(bodyJump);

        parser.consume(LBRACE, "Expected '{' to begin a loop");
        parser.scopedBlock();
        parser.emitLoop(incrementStart);

        parser.patchJump(exitJump);
        parser.emit(OpCode.POP);
        parser.endScope();
    }

    /**
     * {@code foreach (var x = iterable) { body }}
     *
     * <p>可迭代值保存在隐藏槽位中；每轮由 ADVANCE 取下一个值，
     * 耗尽时虚拟机跳过本循环直到回跳指令之后。</p>
     */
    static void foreachLoop(Parser parser, Token keyword) {
        parser.beginScope();
        parser.consume(LPAREN, "Expected '(' after 'foreach'");
        parser.consume(Keyword.VAR, "Expected 'var' to declare the loop variable");
        Token name = parser.consume(IDENTIFIER, "Expected loop variable name");
        parser.consume(ASSIGN, "Expected '=' after loop variable");
        parser.expression();
        int iteratorSlot = parser.declareLocal(name, Parser.ITERATOR_SLOT);
        parser.markInitialized();
        parser.emit(OpCode.NULL);
        int variableSlot = parser.declareLocal(name, name.getLexeme());
        parser.markInitialized();
        parser.consume(RPAREN, "Expected ')' after loop clause");

        int loopStart = parser.currentChunk().size();
        parser.emit(OpCode.GET_LOCAL, iteratorSlot);
        parser.emit(OpCode.ADVANCE);
        parser.emit(OpCode.SET_LOCAL, variableSlot);
        parser.emit(OpCode.POP);

        parser.consume(LBRACE, "Expected '{' to begin a loop");
        parser.scopedBlock();
        parser.emitLoop(loopStart);
        parser.endScope();
    }

    /**
     * {@code return [expr]}；在生成器中等同于 yield
     */
    static void returnStatement(Parser parser, Token keyword) {
        FunctionKind kind = parser.getScope().getKind();
        if (kind == FunctionKind.SCRIPT) {
            throw parser.error(keyword, "Can only return from inside functions");
        }
        returnValue(parser);
        parser.emit(kind == FunctionKind.GENERATOR ? OpCode.YIELD : OpCode.RETURN);
    }

    static void yieldStatement(Parser parser, Token keyword) {
        if (parser.getScope().getKind() != FunctionKind.GENERATOR) {
            throw parser.error(keyword, "Can only yield from inside generators");
        }
        returnValue(parser);
        parser.emit(OpCode.YIELD);
    }

    private static void returnValue(Parser parser) {
        if (parser.check(EOL) || parser.check(RBRACE) || parser.check(EOF)) {
            parser.emit(OpCode.NULL);
        } else {
            parser.expression();
        }
    }

    /**
     * {@code wait seconds}
     */
    static void waitStatement(Parser parser, Token keyword) {
        parser.expression();
        parser.emit(OpCode.SLEEP);
    }

    /**
     * 仪器动作：每个关键词对应一条无操作数指令
     */
    static StatementRule action(OpCode op) {
        return (parser, keyword) -> parser.emit(op);
    }

    /**
     * {@code namespace Name { A, B, C }}
     */
    static void enumeration(Parser parser, Token keyword) {
        if (parser.getScope().getKind() != FunctionKind.SCRIPT) {
            ParseException error = parser.error(keyword, "Enumeration nesting is not supported");
            parser.skipRejectedBlock();
            throw error;
        }
        int global = parser.parseVariable("Expected enumeration name");
        Token name = parser.previous;
        parser.emit(OpCode.ENUM, parser.identifierConstant(name.getLexeme()));
        parser.consume(LBRACE, "Expected '{' to begin enumeration members");

        Set<String> seen = new HashSet<>();
        parser.skipNewlines();
        while (!parser.check(RBRACE)) {
            Token member = parser.consume(IDENTIFIER, "Expected member name");
            if (!seen.add(member.getLexeme())) {
                throw parser.error(member, "Duplicate member '" + member.getLexeme()
                        + "' in enumeration '" + name.getLexeme() + "'");
            }
            parser.emit(OpCode.DEF_FIELD, parser.identifierConstant(member.getLexeme()));
            parser.skipNewlines();
            if (!parser.match(COMMA)) {
                break;
            }
            parser.skipNewlines();
        }
        parser.consume(RBRACE, "Expected '}' to end enumeration");
        parser.defineVariable(global);
    }
}
