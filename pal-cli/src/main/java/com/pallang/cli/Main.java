package com.pallang.cli;

import com.google.gson.JsonParseException;
import pal.runtime.PalValue;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * PAL CLI 入口点（picocli）
 */
@Command(name = "pal", version = "PAL v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {DisasmCommand.class})
public class Main implements Callable<Integer> {

    @Option(names = "-e", description = "执行源码字符串")
    String source;

    @Option(names = "--globals", description = "从 JSON 文件预置全局变量")
    Path globalsFile;

    @Option(names = "--no-wait", description = "wait 语句不等待，立即继续")
    boolean noWait;

    @Option(names = {"-v", "--verbose"}, description = "输出日志（重复使用 -vv 打印指令跟踪）")
    boolean[] verbose = new boolean[0];

    @Parameters(arity = "0..1", description = "脚本文件")
    String script;

    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        LoggingSetup.configure(verbose.length);

        Map<String, PalValue> globals = HostBindings.defaults(out);
        if (globalsFile != null) {
            try {
                globals.putAll(GlobalsLoader.load(globalsFile));
            } catch (IOException | JsonParseException e) {
                err.println("错误: 无法加载全局变量文件 - " + globalsFile + " (" + e.getMessage() + ")");
                return ScriptRunner.EXIT_NO_INPUT;
            }
        }

        ScriptRunner runner = new ScriptRunner(globals, noWait, out, err);
        if (source != null) {
            return runner.runSource(source);
        }
        if (script != null) {
            return runner.runScript(script);
        }
        new ReplRunner(runner, out, err).run();
        return ScriptRunner.EXIT_OK;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
