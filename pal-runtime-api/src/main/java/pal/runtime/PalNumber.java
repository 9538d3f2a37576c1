package pal.runtime;

/**
 * 数值（双精度浮点）
 */
public final class PalNumber extends PalValue {

    private final double value;

    private PalNumber(double value) {
        this.value = value;
    }

    public static PalNumber of(double value) {
        return new PalNumber(value);
    }

    public double getValue() {
        return value;
    }

    /**
     * 是否为整数值
     */
    public boolean isIntegral() {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    @Override
    public String getTypeName() {
        return "Number";
    }

    @Override
    public boolean isTruthy() {
        return value != 0;
    }

    @Override
    public PalValue negate() {
        return of(-value);
    }

    @Override
    public PalValue add(PalValue other) {
        if (other instanceof PalNumber) {
            return of(value + ((PalNumber) other).value);
        }
        return null;
    }

    @Override
    public PalValue sub(PalValue other) {
        if (other instanceof PalNumber) {
            return of(value - ((PalNumber) other).value);
        }
        return null;
    }

    @Override
    public PalValue power(PalValue other) {
        if (other instanceof PalNumber) {
            return of(Math.pow(value, ((PalNumber) other).value));
        }
        return null;
    }

    /**
     * 按位或，仅对两个整数值有效
     */
    @Override
    public PalValue mix(PalValue other) {
        if (other instanceof PalNumber && isIntegral() && ((PalNumber) other).isIntegral()) {
            return of((long) value | (long) ((PalNumber) other).value);
        }
        return null;
    }

    @Override
    public PalValue equal(PalValue other) {
        if (other instanceof PalNumber) {
            return PalBoolean.of(value == ((PalNumber) other).value);
        }
        return null;
    }

    @Override
    public PalValue less(PalValue other) {
        if (other instanceof PalNumber) {
            return PalBoolean.of(value < ((PalNumber) other).value);
        }
        return null;
    }

    @Override
    public PalValue more(PalValue other) {
        if (other instanceof PalNumber) {
            return PalBoolean.of(value > ((PalNumber) other).value);
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PalNumber && Double.compare(((PalNumber) o).value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        if (isIntegral() && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
