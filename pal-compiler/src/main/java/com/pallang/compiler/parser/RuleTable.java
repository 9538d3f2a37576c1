package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Keyword;
import com.pallang.compiler.lexer.Token;
import com.pallang.compiler.lexer.TokenType;
import pal.runtime.bytecode.OpCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Token 类型（关键词按关键词类型）到解析规则的映射
 */
public final class RuleTable {

    private static final Map<TokenType, PrefixRule> PREFIX;
    private static final Map<Keyword, PrefixRule> KEYWORD_PREFIX;
    private static final Map<TokenType, InfixRule> INFIX;
    private static final Map<Keyword, StatementRule> STATEMENTS;

    static {
        Map<TokenType, PrefixRule> prefix = new EnumMap<>(TokenType.class);
        prefix.put(TokenType.NUMBER, PrefixRules::number);
        prefix.put(TokenType.HEX, PrefixRules::number);
        prefix.put(TokenType.BIN, PrefixRules::number);
        prefix.put(TokenType.STRING, PrefixRules::string);
        prefix.put(TokenType.PATH, PrefixRules::path);
        prefix.put(TokenType.IDENTIFIER, PrefixRules::variable);
        prefix.put(TokenType.MINUS, PrefixRules::unary);
        prefix.put(TokenType.BANG, PrefixRules::unary);
        prefix.put(TokenType.LPAREN, PrefixRules::grouping);
        prefix.put(TokenType.LBRACKET, PrefixRules::array);
        PREFIX = Collections.unmodifiableMap(prefix);

        Map<Keyword, PrefixRule> keywordPrefix = new EnumMap<>(Keyword.class);
        for (Keyword keyword : Keyword.values()) {
            switch (keyword.getCategory()) {
                case LITERAL:
                    keywordPrefix.put(keyword, PrefixRules::literal);
                    break;
                case CORRECTION:
                    keywordPrefix.put(keyword, PrefixRules::correction);
                    break;
                case ALGORITHM:
                    keywordPrefix.put(keyword, PrefixRules::algorithm);
                    break;
                default:
                    break;
            }
        }
        KEYWORD_PREFIX = Collections.unmodifiableMap(keywordPrefix);

        Map<TokenType, InfixRule> infix = new EnumMap<>(TokenType.class);
        infix.put(TokenType.CARET, new InfixRules.Binary(Precedence.EXPONENT, OpCode.POWER));
        infix.put(TokenType.PLUS, new InfixRules.Binary(Precedence.TERM, OpCode.ADD));
        infix.put(TokenType.MINUS, new InfixRules.Binary(Precedence.TERM, OpCode.SUB));
        infix.put(TokenType.PIPE, new InfixRules.Binary(Precedence.TERM, OpCode.MIX));
        infix.put(TokenType.EQ, new InfixRules.Binary(Precedence.COMPARISON, OpCode.EQUAL));
        infix.put(TokenType.NE, new InfixRules.Binary(Precedence.COMPARISON, OpCode.EQUAL, OpCode.INVERT));
        infix.put(TokenType.LT, new InfixRules.Binary(Precedence.COMPARISON, OpCode.LESS));
        infix.put(TokenType.GT, new InfixRules.Binary(Precedence.COMPARISON, OpCode.MORE));
        infix.put(TokenType.LE, new InfixRules.Binary(Precedence.COMPARISON, OpCode.MORE, OpCode.INVERT));
        infix.put(TokenType.GE, new InfixRules.Binary(Precedence.COMPARISON, OpCode.LESS, OpCode.INVERT));
        infix.put(TokenType.QUESTION, new InfixRules.Print());
        infix.put(TokenType.LPAREN, new InfixRules.Call());
        infix.put(TokenType.DOT, new InfixRules.Field());
        INFIX = Collections.unmodifiableMap(infix);

        Map<Keyword, StatementRule> statements = new EnumMap<>(Keyword.class);
        statements.put(Keyword.VAR, StatementRules::var);
        statements.put(Keyword.FUNC, StatementRules::function);
        statements.put(Keyword.ITER, StatementRules::generator);
        statements.put(Keyword.NAMESPACE, StatementRules::enumeration);
        statements.put(Keyword.FOR, StatementRules::forLoop);
        statements.put(Keyword.FOREACH, StatementRules::foreachLoop);
        statements.put(Keyword.WAIT, StatementRules::waitStatement);
        statements.put(Keyword.RETURN, StatementRules::returnStatement);
        statements.put(Keyword.YIELD, StatementRules::yieldStatement);
        statements.put(Keyword.SCAN, StatementRules.action(OpCode.SCAN));
        statements.put(Keyword.CLUSTER, StatementRules.action(OpCode.CLUSTER));
        statements.put(Keyword.FILTER, StatementRules.action(OpCode.FILTER));
        statements.put(Keyword.MARK, StatementRules.action(OpCode.MARK));
        statements.put(Keyword.TIGHTEN, StatementRules.action(OpCode.TIGHTEN));
        statements.put(Keyword.SEARCH, StatementRules.action(OpCode.SEARCH));
        STATEMENTS = Collections.unmodifiableMap(statements);
    }

    private RuleTable() {
    }

    /**
     * @return 无前缀规则时返回 null
     */
    public static PrefixRule prefix(Token token) {
        if (token.is(TokenType.KEYWORD)) {
            return KEYWORD_PREFIX.get(token.getKeyword());
        }
        return PREFIX.get(token.getType());
    }

    /**
     * @return 无中缀规则时返回 null
     */
    public static InfixRule infix(Token token) {
        return INFIX.get(token.getType());
    }

    /**
     * @return 不是语句关键词时返回 null
     */
    public static StatementRule statement(Token token) {
        if (!token.is(TokenType.KEYWORD)) {
            return null;
        }
        return STATEMENTS.get(token.getKeyword());
    }
}
