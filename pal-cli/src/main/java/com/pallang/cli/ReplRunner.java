package com.pallang.cli;

import com.pallang.compiler.compiler.PalCompiler;
import com.pallang.compiler.parser.CompileError;
import com.pallang.compiler.parser.CompileResult;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import pal.runtime.PalValue;
import pal.runtime.bytecode.Disassembler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * jline REPL 交互模式
 *
 * <p>每次输入单独编译执行；全局变量在输入之间保留。</p>
 */
public class ReplRunner {

    private static final String VERSION = "0.1.0";
    private static final String PROMPT = "pal> ";
    private static final String CONTINUATION_PROMPT = "...  ";

    private final ScriptRunner runner;
    private final PrintStream out;
    private final PrintStream err;

    private final StringBuilder pending = new StringBuilder();

    public ReplRunner(ScriptRunner runner, PrintStream out, PrintStream err) {
        this.runner = runner;
        this.out = out;
        this.err = err;
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("PAL v" + VERSION + " - 仪器自动化脚本");
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .build();
            runLoop(reader);
        } catch (IOException e) {
            err.println("终端初始化失败: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        out.println("再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(prompt());
                if (line == null || !accept(line)) {
                    break;
                }
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                pending.setLength(0);
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop(BufferedReader reader) {
        while (true) {
            out.print(prompt());
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
            if (line == null || !accept(line)) {
                break;
            }
        }
    }

    private String prompt() {
        return pending.length() > 0 ? CONTINUATION_PROMPT : PROMPT;
    }

    /**
     * 处理一行输入
     *
     * @return true 继续循环，false 退出
     */
    boolean accept(String line) {
        if (pending.length() == 0 && line.startsWith(":")) {
            return handleCommand(line.trim());
        }

        pending.append(line).append('\n');
        if (hasUnclosedBrackets(pending.toString())) {
            return true;
        }

        String source = pending.toString();
        pending.setLength(0);
        if (!source.trim().isEmpty()) {
            runner.evaluate(source, "<repl>");
        }
        return true;
    }

    /**
     * 检查是否有未闭合的括号（忽略字符串、路径与注释）
     */
    static boolean hasUnclosedBrackets(String text) {
        int depth = 0;
        char quote = 0;
        boolean comment = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (comment) {
                comment = c != '\n';
                continue;
            }
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"':
                case '\'':
                    quote = c;
                    break;
                case '#':
                    comment = true;
                    break;
                case '{':
                case '(':
                case '[':
                    depth++;
                    break;
                case '}':
                case ')':
                case ']':
                    depth--;
                    break;
                default:
                    break;
            }
        }
        return depth > 0 || quote != 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    private boolean handleCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }
        if (":help".equals(command) || ":h".equals(command)) {
            printHelp();
            return true;
        }
        if (":version".equals(command)) {
            out.println("PAL v" + VERSION);
            out.println("Java: " + System.getProperty("java.version"));
            return true;
        }
        if (":globals".equals(command)) {
            for (Map.Entry<String, PalValue> entry : runner.getVirtualMachine().getGlobals().entrySet()) {
                out.println(entry.getKey() + " = " + entry.getValue());
            }
            return true;
        }
        if (command.startsWith(":disasm")) {
            String source = command.substring(":disasm".length()).trim();
            CompileResult result = PalCompiler.compile(source, "<repl>");
            if (result.hasErrors()) {
                for (CompileError error : result.getErrors()) {
                    err.println(error.format());
                }
            } else {
                out.print(Disassembler.disassemble(result.getScript()));
            }
            return true;
        }

        out.println("未知命令: " + command);
        out.println("输入 :help 获取帮助");
        return true;
    }

    private void printHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h         显示此帮助");
        out.println("  :quit, :q, :exit  退出 REPL");
        out.println("  :version          显示版本");
        out.println("  :globals          显示全局变量");
        out.println("  :disasm <源码>    打印源码编译后的字节码");
        out.println();
        out.println("示例:");
        out.println("  var x = 40 + 2");
        out.println("  x?");
        out.println("  for (var i = 0, i < 3, i = i + 1) { Scan }");
        out.println();
        out.println("提示:");
        out.println("  - 未闭合的括号会自动进入多行模式");
        out.println("  - 表达式后加 ? 打印其值");
    }
}
