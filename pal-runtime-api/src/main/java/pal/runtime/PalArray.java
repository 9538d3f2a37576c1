package pal.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 可变有序数组
 */
public final class PalArray extends PalValue {

    private final List<PalValue> elements;

    public PalArray() {
        this.elements = new ArrayList<>();
    }

    public PalArray(List<? extends PalValue> elements) {
        this.elements = new ArrayList<>(elements);
    }

    /**
     * 追加元素（数组字面量与宿主构造使用）
     */
    public void append(PalValue value) {
        elements.add(value);
    }

    public PalValue get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    /**
     * 只读视图
     */
    public List<PalValue> getElements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public String getTypeName() {
        return "Array";
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    /**
     * 反转（返回新数组）
     */
    @Override
    public PalValue invert() {
        List<PalValue> reversed = new ArrayList<>(elements);
        Collections.reverse(reversed);
        return new PalArray(reversed);
    }

    /**
     * 拼接（返回新数组）
     */
    @Override
    public PalValue mix(PalValue other) {
        if (other instanceof PalArray) {
            PalArray result = new PalArray(elements);
            result.elements.addAll(((PalArray) other).elements);
            return result;
        }
        return null;
    }

    @Override
    public PalValue equal(PalValue other) {
        if (!(other instanceof PalArray)) {
            return null;
        }
        List<PalValue> theirs = ((PalArray) other).elements;
        if (theirs.size() != elements.size()) {
            return PalBoolean.FALSE;
        }
        for (int i = 0; i < elements.size(); i++) {
            PalValue same = BinaryOperator.EQUAL.apply(elements.get(i), theirs.get(i));
            if (same == null || !same.isTruthy()) {
                return PalBoolean.FALSE;
            }
        }
        return PalBoolean.TRUE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return sb.append(']').toString();
    }
}
