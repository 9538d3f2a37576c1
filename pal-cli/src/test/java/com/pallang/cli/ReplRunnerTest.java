package com.pallang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * REPL 行处理测试（使用回退循环，不依赖终端）
 */
class ReplRunnerTest {

    private ByteArrayOutputStream outBytes;
    private ReplRunner repl;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        ScriptRunner runner = new ScriptRunner(Collections.emptyMap(), true, out, out);
        repl = new ReplRunner(runner, out, out);
    }

    private String session(String input) {
        repl.runFallbackLoop(new BufferedReader(new StringReader(input)));
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("全局变量在输入之间保留")
    void testGlobals() {
        String output = session("var x = 2\n(x + 1)?\n:globals\n");
        assertTrue(output.contains("3"));
        assertTrue(output.contains("x = 2"));
    }

    @Test
    @DisplayName("未闭合的括号进入多行模式")
    void testContinuation() {
        String output = session("for (var i = 0, i < 2, i = i + 1) {\n  (i + 10)?\n}\n");
        assertTrue(output.contains("10"));
        assertTrue(output.contains("11"));
        assertTrue(output.contains("...  "), "续行提示符");
    }

    @Test
    @DisplayName(":quit 结束循环")
    void testQuit() {
        String output = session(":quit\n99?\n");
        assertFalse(output.contains("99"));
    }

    @Test
    @DisplayName(":disasm 打印字节码")
    void testDisasm() {
        String output = session(":disasm Tighten\n");
        assertTrue(output.contains("TIGHTEN"));
    }

    @Test
    @DisplayName("错误不会结束 REPL")
    void testErrorsContinue() {
        String output = session("nope?\n\"still here\"?\n");
        assertTrue(output.contains("Undefined variable 'nope'"));
        assertTrue(output.contains("still here"));
    }

    @Test
    @DisplayName("括号检查忽略字符串与注释")
    void testUnclosedBrackets() {
        assertTrue(ReplRunner.hasUnclosedBrackets("func f() {"));
        assertFalse(ReplRunner.hasUnclosedBrackets("\"{\"?"));
        assertFalse(ReplRunner.hasUnclosedBrackets("Scan # {"));
        assertTrue(ReplRunner.hasUnclosedBrackets("[1,\n"));
        assertFalse(ReplRunner.hasUnclosedBrackets("{ Scan }"));
    }
}
