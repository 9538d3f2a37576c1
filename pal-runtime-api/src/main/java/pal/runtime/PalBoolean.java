package pal.runtime;

/**
 * 布尔值
 */
public final class PalBoolean extends PalValue {

    /** true 常量 */
    public static final PalBoolean TRUE = new PalBoolean(true);

    /** false 常量 */
    public static final PalBoolean FALSE = new PalBoolean(false);

    private final boolean value;

    private PalBoolean(boolean value) {
        this.value = value;
    }

    /**
     * 获取布尔值实例
     */
    public static PalBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Bool";
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public PalValue invert() {
        return of(!value);
    }

    /**
     * 与布尔值比较；与数值比较时 true 等于 1、false 等于其它数值
     */
    @Override
    public PalValue equal(PalValue other) {
        if (other instanceof PalBoolean) {
            return of(value == ((PalBoolean) other).value);
        }
        if (other instanceof PalNumber) {
            return of(value == (((PalNumber) other).getValue() == 1));
        }
        return null;
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}
