package com.pallang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 命令行入口测试
 */
class MainTest {

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
    }

    private int execute(String... args) {
        return new CommandLine(new Main(out, err)).execute(args);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("-e 执行源码")
    void testInlineSource() {
        assertThat(execute("--no-wait", "-e", "Mark\nwait 5\n(1 + 1)?")).isEqualTo(0);
        assertThat(out().split("\\R")).containsExactly("[action] Mark", "2");
    }

    @Test
    @DisplayName("--globals 预置全局变量")
    void testGlobalsFile(@TempDir Path dir) throws IOException {
        Path globals = dir.resolve("globals.json");
        Files.write(globals, "{\"session\": \"/data/s7\", \"algorithm\": \"Minkowski\"}"
                .getBytes(StandardCharsets.UTF_8));

        assertThat(execute("--globals", globals.toString(), "-e", "session?\nalgorithm?")).isEqualTo(0);
        assertThat(out().split("\\R")).containsExactly("/data/s7", "Minkowski");
    }

    @Test
    @DisplayName("无法加载全局变量文件时返回 66")
    void testBadGlobalsFile(@TempDir Path dir) throws IOException {
        Path globals = dir.resolve("globals.json");
        Files.write(globals, "[]".getBytes(StandardCharsets.UTF_8));

        assertThat(execute("--globals", globals.toString(), "-e", "Scan")).isEqualTo(ScriptRunner.EXIT_NO_INPUT);
        assertThat(errBytes.toString(StandardCharsets.UTF_8)).contains("错误: 无法加载全局变量文件");
    }

    @Test
    @DisplayName("脚本文件与退出码")
    void testScriptFile(@TempDir Path dir) throws IOException {
        Path script = dir.resolve("broken.pal");
        Files.write(script, "var = 1\n".getBytes(StandardCharsets.UTF_8));
        assertThat(execute(script.toString())).isEqualTo(ScriptRunner.EXIT_COMPILE_ERROR);
    }

    @Test
    @DisplayName("-v 的次数决定日志级别")
    void testVerbosity() {
        assertThat(LoggingSetup.levelFor(0)).isEqualTo(Level.WARNING);
        assertThat(LoggingSetup.levelFor(1)).isEqualTo(Level.FINE);
        assertThat(LoggingSetup.levelFor(3)).isEqualTo(Level.FINEST);
    }

    @Test
    @DisplayName("disasm 打印字节码")
    void testDisasm() {
        DisasmCommand command = new DisasmCommand(out, err);
        assertThat(command.disassemble("Scan\nwait 1", "probe.pal")).isEqualTo(0);
        assertThat(out())
                .contains("== script ==")
                .contains("SCAN")
                .contains("SLEEP");
        assertThat(command.disassemble("var =", "probe.pal")).isEqualTo(ScriptRunner.EXIT_COMPILE_ERROR);
    }
}
