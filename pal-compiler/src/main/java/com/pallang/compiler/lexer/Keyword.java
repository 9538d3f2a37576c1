package com.pallang.compiler.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 关键词表（区分大小写）
 */
public enum Keyword {

    // 仪器动作
    SCAN("Scan", Category.ACTION),
    CLUSTER("Cluster", Category.ACTION),
    FILTER("filter", Category.ACTION),
    MARK("Mark", Category.ACTION),
    TIGHTEN("Tighten", Category.ACTION),
    SEARCH("Search", Category.ACTION),

    // 校正标签
    DRIFT("drift", Category.CORRECTION),
    EMISSION("emission", Category.CORRECTION),
    FOCUS("focus", Category.CORRECTION),

    // 距离算法标签
    MANHATTAN("Manhattan", Category.ALGORITHM),
    EUCLIDEAN("Euclidean", Category.ALGORITHM),
    MINKOWSKI("Minkowski", Category.ALGORITHM),

    // 字面量
    TRUE("true", Category.LITERAL),
    FALSE("false", Category.LITERAL),
    VOID("void", Category.LITERAL),

    // 语句
    VAR("var", Category.STATEMENT),
    FUNC("func", Category.STATEMENT),
    ITER("iter", Category.STATEMENT),
    NAMESPACE("namespace", Category.STATEMENT),
    FOR("for", Category.STATEMENT),
    FOREACH("foreach", Category.STATEMENT),
    WAIT("wait", Category.STATEMENT),
    RETURN("return", Category.STATEMENT),
    YIELD("yield", Category.STATEMENT);

    /**
     * 关键词类别
     */
    public enum Category {
        ACTION, CORRECTION, ALGORITHM, LITERAL, STATEMENT
    }

    private static final Map<String, Keyword> BY_LEXEME;

    static {
        Map<String, Keyword> map = new HashMap<>();
        for (Keyword keyword : values()) {
            map.put(keyword.lexeme, keyword);
        }
        BY_LEXEME = Collections.unmodifiableMap(map);
    }

    private final String lexeme;
    private final Category category;

    Keyword(String lexeme, Category category) {
        this.lexeme = lexeme;
        this.category = category;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * 按源码拼写查找
     *
     * @return 不是关键词时返回 null
     */
    public static Keyword fromLexeme(String text) {
        return BY_LEXEME.get(text);
    }
}
