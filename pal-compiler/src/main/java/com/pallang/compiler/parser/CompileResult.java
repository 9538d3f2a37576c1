package com.pallang.compiler.parser;

import pal.runtime.PalFunction;

import java.util.Collections;
import java.util.List;

/**
 * 编译结果：顶层脚本函数与收集到的错误列表
 */
public final class CompileResult {
    private final PalFunction script;
    private final List<CompileError> errors;

    public CompileResult(PalFunction script, List<CompileError> errors) {
        this.script = script;
        this.errors = Collections.unmodifiableList(errors);
    }

    /**
     * @return 有错误时为 null
     */
    public PalFunction getScript() {
        return script;
    }

    public List<CompileError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
