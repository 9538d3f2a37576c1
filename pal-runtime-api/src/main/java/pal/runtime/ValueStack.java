package pal.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 共享操作数栈
 *
 * <p>一次运行中所有调用帧共用同一个栈，每帧拥有从其基址开始的窗口。</p>
 */
public final class ValueStack {

    /** 默认容量上限 */
    public static final int DEFAULT_LIMIT = 65536;

    private PalValue[] values = new PalValue[64];
    private int size;
    private final int limit;

    public ValueStack() {
        this(DEFAULT_LIMIT);
    }

    public ValueStack(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Stack limit must be positive: " + limit);
        }
        this.limit = limit;
    }

    public void push(PalValue value) {
        if (size >= limit) {
            throw new PalException("Stack overflow");
        }
        if (size == values.length) {
            values = Arrays.copyOf(values, Math.min(limit, size * 2));
        }
        values[size++] = value;
    }

    /**
     * 依次压入多个值
     */
    public void pushAll(List<PalValue> items) {
        for (PalValue item : items) {
            push(item);
        }
    }

    public PalValue pop() {
        if (size == 0) {
            throw new PalException("Stack underflow");
        }
        PalValue value = values[--size];
        values[size] = null;
        return value;
    }

    /**
     * 查看距栈顶 distance 处的值（0 为栈顶）
     */
    public PalValue peek(int distance) {
        int index = size - 1 - distance;
        if (distance < 0 || index < 0) {
            throw new PalException("Stack underflow");
        }
        return values[index];
    }

    public PalValue peek() {
        return peek(0);
    }

    public PalValue get(int index) {
        checkIndex(index);
        return values[index];
    }

    public void set(int index, PalValue value) {
        checkIndex(index);
        values[index] = value;
    }

    public int size() {
        return size;
    }

    /**
     * 将栈收缩到 newSize（只能变小）
     */
    public void truncate(int newSize) {
        if (newSize < 0 || newSize > size) {
            throw new PalException("Stack underflow");
        }
        Arrays.fill(values, newSize, size, null);
        size = newSize;
    }

    /**
     * 复制 [from, size) 区间
     */
    public List<PalValue> sliceFrom(int from) {
        if (from < 0 || from > size) {
            throw new PalException("Stack underflow");
        }
        return new ArrayList<>(Arrays.asList(values).subList(from, size));
    }

    public void clear() {
        truncate(0);
    }

    /**
     * 当前内容快照（自底向上）
     */
    public List<PalValue> snapshot() {
        return Collections.unmodifiableList(sliceFrom(0));
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new PalException("Stack slot " + index + " is out of range (size " + size + ")");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < size; i++) {
            sb.append("[ ").append(values[i]).append(" ]");
        }
        return sb.toString();
    }
}
