package com.pallang.compiler.lexer;

/**
 * 词法单元
 *
 * <p>字面量载荷：数值类为 {@link Double}，字符串与路径为去掉引号的内容，
 * 关键词为 {@link Keyword}，错误单元为错误信息。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    /**
     * 是否为指定关键词
     */
    public boolean is(Keyword keyword) {
        return type == TokenType.KEYWORD && literal == keyword;
    }

    /**
     * @return 非关键词时返回 null
     */
    public Keyword getKeyword() {
        return type == TokenType.KEYWORD ? (Keyword) literal : null;
    }

    /**
     * 数值字面量的进制，非数值返回 0
     */
    public int getBase() {
        switch (type) {
            case NUMBER: return 10;
            case HEX:    return 16;
            case BIN:    return 2;
            default:     return 0;
        }
    }

    @Override
    public String toString() {
        String shown = type == TokenType.EOL ? "\\n" : lexeme;
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, shown, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d",
                type, shown, line, column);
    }
}
