package pal.runtime;

/**
 * 字符串值
 */
public final class PalString extends PalValue {

    private final String value;

    private PalString(String value) {
        this.value = value;
    }

    public static PalString of(String value) {
        return new PalString(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public PalValue add(PalValue other) {
        if (other instanceof PalString) {
            return of(value + ((PalString) other).value);
        }
        return null;
    }

    @Override
    public PalValue equal(PalValue other) {
        if (other instanceof PalString) {
            return PalBoolean.of(value.equals(((PalString) other).value));
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PalString && ((PalString) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
