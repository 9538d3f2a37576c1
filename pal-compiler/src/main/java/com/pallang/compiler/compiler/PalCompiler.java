package com.pallang.compiler.compiler;

import com.pallang.compiler.lexer.Lexer;
import com.pallang.compiler.parser.CompileResult;
import com.pallang.compiler.parser.Parser;
import pal.runtime.PalFunction;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PAL 编译器 API
 *
 * <p>源码 → 顶层脚本函数。嵌套的函数与生成器保存在脚本常量池中。</p>
 */
public final class PalCompiler {

    private static final Logger LOG = Logger.getLogger(PalCompiler.class.getName());

    private PalCompiler() {
    }

    /**
     * 编译源码，收集全部语法错误
     */
    public static CompileResult compile(String source, String fileName) {
        long start = System.nanoTime();
        CompileResult result = new Parser(new Lexer(source, fileName), fileName).compile();
        if (LOG.isLoggable(Level.FINE)) {
            long micros = (System.nanoTime() - start) / 1000;
            if (result.hasErrors()) {
                LOG.fine(fileName + ": " + result.getErrors().size() + " syntax error(s) in " + micros + "us");
            } else {
                LOG.fine(fileName + ": compiled " + result.getScript().getChunk().size()
                        + " code units in " + micros + "us");
            }
        }
        return result;
    }

    public static CompileResult compile(String source) {
        return compile(source, "<input>");
    }

    /**
     * 编译源码，有错误时抛出
     *
     * @throws CompileException 存在语法错误
     */
    public static PalFunction compileOrThrow(String source, String fileName) {
        CompileResult result = compile(source, fileName);
        if (result.hasErrors()) {
            throw new CompileException(result.getErrors());
        }
        return result.getScript();
    }
}
