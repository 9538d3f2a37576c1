package pal.runtime.vm;

import pal.runtime.PalFunction;
import pal.runtime.PalIterator;
import pal.runtime.bytecode.InstructionPointer;

/**
 * 调用帧：正在执行的函数、指令游标与栈窗口基址
 */
public final class CallFrame {

    private final PalFunction function;
    private final InstructionPointer ip;
    private final int base;
    private final PalIterator iterator;

    CallFrame(PalFunction function, InstructionPointer ip, int base, PalIterator iterator) {
        this.function = function;
        this.ip = ip;
        this.base = base;
        this.iterator = iterator;
    }

    public PalFunction getFunction() {
        return function;
    }

    public InstructionPointer getIp() {
        return ip;
    }

    /**
     * 窗口基址：被调用者所在的栈位置
     */
    public int getBase() {
        return base;
    }

    /**
     * 驱动生成器帧的迭代器；普通函数帧为 null
     */
    public PalIterator getIterator() {
        return iterator;
    }

    public String getName() {
        return function.getName();
    }

    public int getLine() {
        return ip.getLine();
    }

    /**
     * 回溯条目 {@code [line N in name]}
     */
    public String describe() {
        return "[line " + getLine() + " in " + getName() + "]";
    }

    @Override
    public String toString() {
        return describe();
    }
}
