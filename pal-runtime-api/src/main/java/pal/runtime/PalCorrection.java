package pal.runtime;

import java.util.Locale;

/**
 * 校正类型标签（{@code drift} / {@code emission} / {@code focus}）
 */
public final class PalCorrection extends PalValue {

    public static final PalCorrection DRIFT = new PalCorrection("drift");
    public static final PalCorrection EMISSION = new PalCorrection("emission");
    public static final PalCorrection FOCUS = new PalCorrection("focus");

    private final String name;

    private PalCorrection(String name) {
        this.name = name;
    }

    /**
     * 按名称查找校正标签
     *
     * @throws IllegalArgumentException 未知名称
     */
    public static PalCorrection of(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "drift":    return DRIFT;
            case "emission": return EMISSION;
            case "focus":    return FOCUS;
            default:
                throw new IllegalArgumentException("Unknown correction '" + name + "'");
        }
    }

    public String getName() {
        return name;
    }

    @Override
    public String getTypeName() {
        return "Correction";
    }

    @Override
    public PalValue equal(PalValue other) {
        if (other instanceof PalCorrection) {
            return PalBoolean.of(this == other);
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
