package com.pallang.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // 字面量
    NUMBER,         // 十进制数 1, 2.5
    HEX,            // \xFF
    BIN,            // \b1010
    STRING,         // "text"
    PATH,           // 'C:/data'
    IDENTIFIER,
    KEYWORD,        // 具体关键词见 Keyword

    // 分隔符
    COMMA,          // ,
    DOT,            // .
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }

    // 运算符
    ASSIGN,         // =
    QUESTION,       // ? 打印
    MINUS,          // -
    BANG,           // !
    CARET,          // ^
    PLUS,           // +
    PIPE,           // |
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // 特殊
    EOL,            // 换行（语句结束）
    ERROR,          // 词法错误，字面量为错误信息
    EOF
}
