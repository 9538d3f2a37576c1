package com.pallang.cli;

import pal.runtime.PalValue;
import pal.runtime.vm.PalRuntimeException;
import pal.runtime.vm.RunStatus;
import pal.runtime.vm.VirtualMachine;
import pal.runtime.vm.WaitHandler;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 脚本和源码字符串执行器
 *
 * <p>脚本输出写到 out，语法错误与运行时错误写到 err。返回进程退出码。</p>
 */
public class ScriptRunner {

    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 65;
    public static final int EXIT_NO_INPUT = 66;
    public static final int EXIT_RUNTIME_ERROR = 70;

    private final VirtualMachine vm;
    private final ConsoleInstrument instrument;
    private final PrintStream err;

    public ScriptRunner(Map<String, PalValue> globals, boolean noWait, PrintStream out, PrintStream err) {
        this.err = err;
        this.instrument = new ConsoleInstrument(out);
        this.vm = VirtualMachine.builder()
                .globals(globals)
                .output(out::println)
                .errorOutput(err::println)
                .instrumentActions(instrument)
                .waitHandler(noWait ? WaitHandler.NONE : WaitHandler.SLEEP)
                .onVariableChanged((name, value) -> LOG.fine(() -> "Global '" + name + "' changed to " + value))
                .build();
    }

    /**
     * 执行脚本文件
     */
    public int runScript(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return EXIT_NO_INPUT;
        }
        if (!Files.isReadable(path)) {
            err.println("错误: 无法读取文件 - " + filePath);
            return EXIT_NO_INPUT;
        }

        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            return EXIT_NO_INPUT;
        }
        return run(source, path.getFileName().toString());
    }

    /**
     * 执行命令行给出的源码
     */
    public int runSource(String source) {
        return run(source, "<cmdline>");
    }

    /**
     * 执行一段源码，全局变量保留到下一次执行
     */
    public RunStatus evaluate(String source, String fileName) {
        return vm.run(source, fileName);
    }

    private int run(String source, String fileName) {
        RunStatus status = vm.run(source, fileName);
        switch (status) {
            case COMPILE_ERROR:
                return EXIT_COMPILE_ERROR;
            case RUNTIME_ERROR:
                PalRuntimeException error = vm.getLastError();
                if (error != null && error.getCause() != null && error.getCause() != error) {
                    LOG.fine(() -> "Runtime error cause: " + error.getCause());
                }
                return EXIT_RUNTIME_ERROR;
            default:
                return EXIT_OK;
        }
    }

    public VirtualMachine getVirtualMachine() {
        return vm;
    }

    public ConsoleInstrument getInstrument() {
        return instrument;
    }
}
