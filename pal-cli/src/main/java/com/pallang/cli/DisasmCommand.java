package com.pallang.cli;

import com.pallang.compiler.compiler.PalCompiler;
import com.pallang.compiler.parser.CompileError;
import com.pallang.compiler.parser.CompileResult;
import pal.runtime.bytecode.Disassembler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 编译脚本并打印字节码，不执行
 */
@Command(name = "disasm", description = "编译脚本并打印反汇编的字节码")
public class DisasmCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "脚本文件")
    Path file;

    private final PrintStream out;
    private final PrintStream err;

    public DisasmCommand() {
        this(System.out, System.err);
    }

    DisasmCommand(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + file);
            return ScriptRunner.EXIT_NO_INPUT;
        }
        return disassemble(source, file.getFileName().toString());
    }

    int disassemble(String source, String fileName) {
        CompileResult result = PalCompiler.compile(source, fileName);
        if (result.hasErrors()) {
            for (CompileError error : result.getErrors()) {
                err.println(error.format());
            }
            return ScriptRunner.EXIT_COMPILE_ERROR;
        }
        out.print(Disassembler.disassemble(result.getScript()));
        return ScriptRunner.EXIT_OK;
    }
}
