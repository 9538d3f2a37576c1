package com.pallang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pal.runtime.PalArray;
import pal.runtime.PalException;
import pal.runtime.PalNativeIterator;
import pal.runtime.PalNumber;
import pal.runtime.PalValue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 模拟宿主绑定测试
 */
class HostBindingsTest {

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private ScriptRunner runner;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        runner = new ScriptRunner(HostBindings.defaults(out), true, out, err);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private static PalArray pair(double a, double b) {
        return new PalArray(Arrays.asList(PalNumber.of(a), PalNumber.of(b)));
    }

    /** 取出迭代器的全部位置 */
    private static List<String> positions(PalValue iterator) {
        PalNativeIterator it = (PalNativeIterator) iterator;
        List<String> result = new ArrayList<>();
        while (it.hasNext()) {
            result.add(it.next().toString());
        }
        return result;
    }

    @Test
    @DisplayName("蛇形扫描：起点、每列一步、每行结束一步")
    void testSnakeOrder() {
        List<String> steps = positions(HostBindings.stageSnake(Arrays.asList(pair(1, 1), pair(3, 2))));
        assertThat(steps).containsExactly(
                "[0, 0]",
                "[1, 0]", "[2, 0]", "[3, 0]", "[3, 1]",
                "[2, 1]", "[1, 1]", "[0, 1]", "[0, 2]");
    }

    @Test
    @DisplayName("位置个数为 1 + 行数 * (列数 + 1)")
    void testSnakeCount() {
        List<String> steps = positions(HostBindings.stageSnake(Arrays.asList(pair(5, 5), pair(4, 3))));
        assertThat(steps).hasSize(1 + 3 * (4 + 1));
        assertThat(steps.get(steps.size() - 1)).isEqualTo("[20, 15]");
    }

    @Test
    @DisplayName("参数必须是两个整数组成的数组")
    void testSnakeArguments() {
        assertThatThrownBy(() -> HostBindings.stageSnake(Arrays.asList(PalNumber.of(1), pair(1, 1))))
                .isInstanceOf(PalException.class)
                .hasMessage("stage_snake expects two arrays of two whole numbers, got 'Number'");
        assertThatThrownBy(() -> HostBindings.stageSnake(Arrays.asList(pair(0.5, 1), pair(1, 1))))
                .isInstanceOf(PalException.class);
        assertThatThrownBy(() -> HostBindings.stageSnake(Arrays.asList(pair(1, 1), pair(-1, 1))))
                .isInstanceOf(PalException.class)
                .hasMessage("stage_snake sizes must not be negative");
    }

    @Test
    @DisplayName("脚本中驱动 foreach")
    void testSnakeInScript() {
        int exit = runner.runSource("var n = 0\n"
                + "foreach (var p = stage_snake([1, 1], [2, 2])) {\n"
                + "  Scan\n"
                + "  n = n + 1\n"
                + "}\n"
                + "n?");
        assertThat(exit).isEqualTo(ScriptRunner.EXIT_OK);
        assertThat(runner.getInstrument().getPerformed()).hasSize(7);
        assertThat(out()).endsWith("7" + System.lineSeparator());
    }

    @Test
    @DisplayName("校正与枚举")
    void testCorrectionAndEnums() {
        int exit = runner.runSource("correct_for(drift)\nCorner.BOTTOM_RIGHT?\nAxis.Z?");
        assertThat(exit).isEqualTo(ScriptRunner.EXIT_OK);
        assertThat(out().split("\\R")).containsExactly("[correct] drift", "3", "2");
    }

    @Test
    @DisplayName("correct_for 只接受校正标签")
    void testCorrectionArgument() {
        int exit = runner.runSource("correct_for(1)");
        assertThat(exit).isEqualTo(ScriptRunner.EXIT_RUNTIME_ERROR);
        assertThat(errBytes.toString(StandardCharsets.UTF_8))
                .contains("correct_for expects a correction, got 'Number'");
    }

    @Test
    @DisplayName("动作打印关键词")
    void testConsoleInstrument() {
        runner.runSource("Scan\nfilter\nSearch");
        assertThat(runner.getInstrument().getPerformed()).containsExactly("Scan", "filter", "Search");
        assertThat(out().split("\\R")).containsExactly("[action] Scan", "[action] filter", "[action] Search");
    }

    @Test
    @DisplayName("预置全局变量")
    void testDefaults() {
        assertThat(HostBindings.defaults(new PrintStream(new ByteArrayOutputStream())).keySet())
                .containsExactly("Corner", "Axis", "stage_snake", "correct_for");
    }
}
