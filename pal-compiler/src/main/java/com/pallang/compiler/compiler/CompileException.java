package com.pallang.compiler.compiler;

import com.pallang.compiler.parser.CompileError;
import pal.runtime.PalException;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 编译失败：包含全部语法错误
 */
public class CompileException extends PalException {
    private final List<CompileError> errors;

    public CompileException(List<CompileError> errors) {
        super(errors.stream().map(CompileError::format).collect(Collectors.joining("\n")));
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<CompileError> getErrors() {
        return errors;
    }
}
