package com.pallang.cli;

import pal.runtime.PalArray;
import pal.runtime.PalCorrection;
import pal.runtime.PalException;
import pal.runtime.PalNativeEnum;
import pal.runtime.PalNativeFunction;
import pal.runtime.PalNativeIterator;
import pal.runtime.PalNil;
import pal.runtime.PalNumber;
import pal.runtime.PalValue;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 命令行宿主预置的全局值：模拟样品台、校正与枚举
 */
public final class HostBindings {

    private static final Logger LOG = Logger.getLogger(HostBindings.class.getName());

    /**
     * 图像包围盒的角
     */
    public enum Corner {
        TOP_LEFT, TOP_RIGHT, BOTTOM_LEFT, BOTTOM_RIGHT
    }

    /**
     * 坐标轴
     */
    public enum Axis {
        X, Y, Z
    }

    private HostBindings() {
    }

    /**
     * @param out 模拟动作的输出
     */
    public static Map<String, PalValue> defaults(PrintStream out) {
        Map<String, PalValue> globals = new LinkedHashMap<>();
        globals.put("Corner", PalNativeEnum.of(Corner.class));
        globals.put("Axis", PalNativeEnum.of(Axis.class));
        globals.put("stage_snake", new PalNativeFunction("stage_snake", 2, HostBindings::stageSnake));
        globals.put("correct_for", new PalNativeFunction("correct_for", 1, args -> correctFor(args, out)));
        return globals;
    }

    /**
     * {@code stage_snake([step_x, step_y], [count_x, count_y])}
     *
     * <p>返回蛇形扫描各位置的原生迭代器，每项为 {@code [x, y]}。
     * 第一项是移动前的起点；每行结束后沿 y 前进一步，行方向交替。</p>
     */
    static PalValue stageSnake(List<PalValue> args) {
        long[] step = pair(args.get(0));
        long[] size = pair(args.get(1));
        if (size[0] < 0 || size[1] < 0) {
            throw new PalException("stage_snake sizes must not be negative");
        }

        List<PalValue> positions = new ArrayList<>();
        long x = 0;
        long y = 0;
        positions.add(position(x, y));
        for (long row = 0; row < size[1]; row++) {
            long dx = row % 2 == 0 ? step[0] : -step[0];
            for (long column = 0; column < size[0]; column++) {
                x += dx;
                positions.add(position(x, y));
            }
            y += step[1];
            positions.add(position(x, y));
        }
        LOG.fine("stage_snake planned " + positions.size() + " positions");
        return new PalNativeIterator("stage_snake", positions.iterator());
    }

    private static long[] pair(PalValue value) {
        if (value instanceof PalArray && ((PalArray) value).size() == 2) {
            PalArray array = (PalArray) value;
            PalValue first = array.get(0);
            PalValue second = array.get(1);
            if (isWhole(first) && isWhole(second)) {
                return new long[]{
                        (long) ((PalNumber) first).getValue(),
                        (long) ((PalNumber) second).getValue()};
            }
        }
        throw new PalException("stage_snake expects two arrays of two whole numbers, got '"
                + value.getTypeName() + "'");
    }

    private static boolean isWhole(PalValue value) {
        return value instanceof PalNumber && ((PalNumber) value).isIntegral();
    }

    private static PalValue position(long x, long y) {
        return new PalArray(Arrays.asList(PalNumber.of(x), PalNumber.of(y)));
    }

    private static PalValue correctFor(List<PalValue> args, PrintStream out) {
        PalValue correction = args.get(0);
        if (!(correction instanceof PalCorrection)) {
            throw new PalException("correct_for expects a correction, got '" + correction.getTypeName() + "'");
        }
        out.println("[correct] " + correction);
        return PalNil.NIL;
    }
}
