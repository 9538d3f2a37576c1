package pal.runtime;

import java.util.Iterator;

/**
 * 宿主提供的迭代器
 */
public final class PalNativeIterator extends PalValue {

    private final String name;
    private final Iterator<? extends PalValue> source;

    public PalNativeIterator(String name, Iterator<? extends PalValue> source) {
        this.name = name;
        this.source = source;
    }

    public String getName() {
        return name;
    }

    public boolean hasNext() {
        return source.hasNext();
    }

    /**
     * 取下一个元素，宿主返回 null 时视为 {@link PalNil#NIL}
     */
    public PalValue next() {
        PalValue value = source.next();
        return value != null ? value : PalNil.NIL;
    }

    @Override
    public String getTypeName() {
        return "NativeIterator";
    }

    @Override
    public String toString() {
        return "<NativeIterator " + name + ">";
    }
}
