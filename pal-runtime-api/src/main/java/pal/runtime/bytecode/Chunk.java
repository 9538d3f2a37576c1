package pal.runtime.bytecode;

import pal.runtime.PalValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 字节码块：指令与操作数序列、常量池、逐条行号表
 */
public final class Chunk {

    private int[] code = new int[32];
    private int[] lines = new int[32];
    private int size;
    private final List<PalValue> constants = new ArrayList<>();

    /**
     * 追加一个指令或操作数
     */
    public void write(int value, int line) {
        if (size == code.length) {
            code = Arrays.copyOf(code, size * 2);
            lines = Arrays.copyOf(lines, size * 2);
        }
        code[size] = value;
        lines[size] = line;
        size++;
    }

    public void write(OpCode op, int line) {
        write(op.getCode(), line);
    }

    /**
     * 覆写已写入的位置（用于回填跳转）
     */
    public void set(int index, int value) {
        checkIndex(index);
        code[index] = value;
    }

    public int get(int index) {
        checkIndex(index);
        return code[index];
    }

    public int getLine(int index) {
        checkIndex(index);
        return lines[index];
    }

    public int size() {
        return size;
    }

    /**
     * 加入常量池
     *
     * @return 常量索引，之后不再改变
     */
    public int addConstant(PalValue value) {
        constants.add(value);
        return constants.size() - 1;
    }

    public PalValue getConstant(int index) {
        return constants.get(index);
    }

    public int getConstantCount() {
        return constants.size();
    }

    public List<PalValue> getConstants() {
        return Collections.unmodifiableList(constants);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Chunk index " + index + " out of range (size " + size + ")");
        }
    }
}
