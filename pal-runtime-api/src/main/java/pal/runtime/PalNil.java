package pal.runtime;

/**
 * 空值（源码中写作 {@code void}）
 */
public final class PalNil extends PalValue {

    public static final PalNil NIL = new PalNil();

    private PalNil() {
    }

    @Override
    public String getTypeName() {
        return "Nil";
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public PalValue equal(PalValue other) {
        return PalBoolean.of(other == NIL);
    }

    @Override
    public String toString() {
        return "void";
    }
}
