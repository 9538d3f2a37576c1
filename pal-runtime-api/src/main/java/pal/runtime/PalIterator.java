package pal.runtime;

/**
 * 包装一个预备好的生成器，由 ADVANCE 指令驱动
 */
public final class PalIterator extends PalValue {

    private final PalGenerator generator;
    private boolean exhausted;

    public PalIterator(PalGenerator generator) {
        this.generator = generator;
    }

    public PalGenerator getGenerator() {
        return generator;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * 生成器函数返回后调用
     */
    public void markExhausted() {
        this.exhausted = true;
    }

    @Override
    public String getTypeName() {
        return "Iterator";
    }

    @Override
    public String toString() {
        return "<Iterator " + generator.getName() + ">";
    }
}
