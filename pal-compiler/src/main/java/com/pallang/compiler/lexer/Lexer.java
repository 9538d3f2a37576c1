package com.pallang.compiler.lexer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PAL 词法分析器
 *
 * <p>逐字符扫描，每次调用 {@link #nextToken()} 产生一个 Token。换行作为语句结束符
 * 输出为 {@link TokenType#EOL}；输入结束后始终返回 {@link TokenType#EOF}。
 * 词法错误不会抛出异常，而是产生 {@link TokenType#ERROR} 单元。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    // 起始位置（多行字符串会推进 line）
    private int startLine = 1;
    private int startColumn = 1;

    /** 符号最长匹配长度 */
    private static final int MAX_SYMBOL_LENGTH = 3;

    // 符号映射表
    private static final Map<String, TokenType> SYMBOLS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 分隔符
        map.put(",", TokenType.COMMA);
        map.put(".", TokenType.DOT);
        map.put("(", TokenType.LPAREN);
        map.put(")", TokenType.RPAREN);
        map.put("[", TokenType.LBRACKET);
        map.put("]", TokenType.RBRACKET);
        map.put("{", TokenType.LBRACE);
        map.put("}", TokenType.RBRACE);

        // 运算符
        map.put("=", TokenType.ASSIGN);
        map.put("?", TokenType.QUESTION);
        map.put("-", TokenType.MINUS);
        map.put("!", TokenType.BANG);
        map.put("^", TokenType.CARET);
        map.put("+", TokenType.PLUS);
        map.put("|", TokenType.PIPE);
        map.put("==", TokenType.EQ);
        map.put("!=", TokenType.NE);
        map.put("<", TokenType.LT);
        map.put(">", TokenType.GT);
        map.put("<=", TokenType.LE);
        map.put(">=", TokenType.GE);

        SYMBOLS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token，输入结束后始终为 EOF
     */
    public Token nextToken() {
        // 跳过空白与注释（但不跳过换行）
        skipWhitespace();

        start = current;
        startLine = line;
        startColumn = current - lineStart + 1;

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", null, line, startColumn, current);
        }

        char c = advance();

        if (c == '\n') {
            Token eol = makeToken(TokenType.EOL, null);
            newLine();
            return eol;
        }
        if (isAlpha(c)) {
            return identifier();
        }
        if (isDigit(c)) {
            return number();
        }

        switch (c) {
            case '"':
                return text('"', TokenType.STRING, "Unterminated string");
            case '\'':
                return text('\'', TokenType.PATH, "Unterminated path");
            case '\\':
                if (match('x') || match('X')) {
                    return baseNumber(TokenType.HEX, 16);
                }
                if (match('b') || match('B')) {
                    return baseNumber(TokenType.BIN, 2);
                }
                return errorToken("Unknown symbol '\\'");
            default:
                return symbol();
        }
    }

    /**
     * 扫描全部 Token（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '#') {
                // 行注释，保留换行作为语句结束
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isDigitOfBase(char c, int base) {
        if (base == 2) {
            return c == '0' || c == '1';
        }
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    // === Token 构建 ===

    private Token makeToken(TokenType type, Object literal) {
        return new Token(type, source.substring(start, current), literal, startLine, startColumn, start);
    }

    private Token errorToken(String message) {
        return new Token(TokenType.ERROR, source.substring(start, current), message, startLine, startColumn, start);
    }

    // === 复杂 Token 扫描 ===

    private Token identifier() {
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        Keyword keyword = Keyword.fromLexeme(text);
        if (keyword != null) {
            return makeToken(TokenType.KEYWORD, keyword);
        }
        return makeToken(TokenType.IDENTIFIER, null);
    }

    private Token number() {
        boolean dot = false;
        while (!isAtEnd() && (isDigit(peek()) || (peek() == '.' && !dot))) {
            if (advance() == '.') {
                dot = true;
            }
        }
        return makeToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private Token baseNumber(TokenType type, int base) {
        int digitsStart = current;
        while (!isAtEnd() && isDigitOfBase(peek(), base)) {
            advance();
        }
        if (current == digitsStart) {
            return errorToken("Expected numerical literal");
        }
        double value = new BigInteger(source.substring(digitsStart, current), base).doubleValue();
        return makeToken(type, value);
    }

    private Token text(char delimiter, TokenType type, String unterminated) {
        while (!isAtEnd() && peek() != delimiter) {
            if (advance() == '\n') {
                newLine();
            }
        }
        if (isAtEnd()) {
            return errorToken(unterminated);
        }
        advance(); // 闭合引号
        return makeToken(type, source.substring(start + 1, current - 1));
    }

    private Token symbol() {
        // 最长匹配：从 3 个字符开始回退
        for (int length = MAX_SYMBOL_LENGTH; length > 1; length--) {
            int end = start + length;
            if (end > source.length()) {
                continue;
            }
            TokenType type = SYMBOLS.get(source.substring(start, end));
            if (type != null) {
                current = end;
                return makeToken(type, null);
            }
        }
        TokenType type = SYMBOLS.get(String.valueOf(source.charAt(start)));
        if (type != null) {
            return makeToken(type, null);
        }
        return errorToken("Unknown symbol '" + source.charAt(start) + "'");
    }
}
