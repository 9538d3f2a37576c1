package com.pallang.compiler.parser;

import pal.runtime.PalFunction;
import pal.runtime.PalGenerator;
import pal.runtime.PalValue;
import pal.runtime.bytecode.Chunk;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个函数（或顶层脚本、生成器）的编译状态
 *
 * <p>按声明顺序记录局部变量，槽位 0 预留给被调用者本身。
 * 通过 {@link #getEnclosing()} 链接到外层函数。</p>
 */
final class FunctionScope {

    /** 局部变量上限（含槽位 0） */
    static final int MAX_LOCALS = 256;

    private final FunctionScope enclosing;
    private final FunctionKind kind;
    private final String name;
    private final Chunk chunk = new Chunk();
    private final List<Local> locals = new ArrayList<>();
    private int scopeDepth;
    private int arity;

    FunctionScope(FunctionScope enclosing, FunctionKind kind, String name) {
        this.enclosing = enclosing;
        this.kind = kind;
        this.name = name;
        // 槽位 0：被调用者
        locals.add(new Local("", 0));
    }

    FunctionScope getEnclosing() {
        return enclosing;
    }

    FunctionKind getKind() {
        return kind;
    }

    String getName() {
        return name;
    }

    Chunk getChunk() {
        return chunk;
    }

    int getScopeDepth() {
        return scopeDepth;
    }

    int getArity() {
        return arity;
    }

    void addParameter() {
        arity++;
    }

    boolean isGlobalScope() {
        return scopeDepth == 0;
    }

    // ============ 作用域 ============

    void beginScope() {
        scopeDepth++;
    }

    /**
     * 结束当前块作用域
     *
     * @return 离开作用域的局部变量个数（调用方为每个生成一次 POP）
     */
    int endScope() {
        scopeDepth--;
        int removed = 0;
        while (locals.size() > 1 && locals.get(locals.size() - 1).depth > scopeDepth) {
            locals.remove(locals.size() - 1);
            removed++;
        }
        return removed;
    }

    /**
     * 语法错误恢复时回到记录点
     */
    void restore(int depth, int localCount) {
        scopeDepth = depth;
        while (locals.size() > localCount) {
            locals.remove(locals.size() - 1);
        }
    }

    int getLocalCount() {
        return locals.size();
    }

    // ============ 局部变量 ============

    /**
     * 当前块作用域内是否已有同名变量
     */
    boolean isDeclaredInCurrentScope(String localName) {
        for (int i = locals.size() - 1; i > 0; i--) {
            Local local = locals.get(i);
            if (local.isInitialized() && local.depth < scopeDepth) {
                break;
            }
            if (local.name.equals(localName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return 新变量的槽位；超过上限时返回 -1
     */
    int addLocal(String localName) {
        if (locals.size() >= MAX_LOCALS) {
            return -1;
        }
        locals.add(new Local(localName, Local.UNINITIALIZED));
        return locals.size() - 1;
    }

    void markInitialized() {
        if (scopeDepth == 0) {
            return;
        }
        locals.get(locals.size() - 1).depth = scopeDepth;
    }

    /**
     * 由近及远查找局部变量
     *
     * @return 槽位，未找到返回 -1
     */
    int resolveLocal(String localName) {
        for (int i = locals.size() - 1; i > 0; i--) {
            if (locals.get(i).name.equals(localName)) {
                return i;
            }
        }
        return -1;
    }

    boolean isInitialized(int slot) {
        return locals.get(slot).isInitialized();
    }

    /**
     * 构建编译结果：顶层与普通函数得到 {@link PalFunction}，生成器得到 {@link PalGenerator}
     */
    PalValue toValue() {
        PalFunction function = new PalFunction(name, arity, chunk);
        return kind == FunctionKind.GENERATOR ? new PalGenerator(function) : function;
    }
}
