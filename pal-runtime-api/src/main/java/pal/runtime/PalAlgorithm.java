package pal.runtime;

/**
 * 距离算法标签（{@code Manhattan} / {@code Euclidean} / {@code Minkowski}）
 */
public final class PalAlgorithm extends PalValue {

    public static final PalAlgorithm MANHATTAN = new PalAlgorithm("Manhattan");
    public static final PalAlgorithm EUCLIDEAN = new PalAlgorithm("Euclidean");
    public static final PalAlgorithm MINKOWSKI = new PalAlgorithm("Minkowski");

    private final String name;

    private PalAlgorithm(String name) {
        this.name = name;
    }

    /**
     * 按名称查找算法标签（大小写不敏感）
     *
     * @throws IllegalArgumentException 未知名称
     */
    public static PalAlgorithm of(String name) {
        for (PalAlgorithm algorithm : new PalAlgorithm[]{MANHATTAN, EUCLIDEAN, MINKOWSKI}) {
            if (algorithm.name.equalsIgnoreCase(name)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm '" + name + "'");
    }

    public String getName() {
        return name;
    }

    @Override
    public String getTypeName() {
        return "Algorithm";
    }

    @Override
    public PalValue equal(PalValue other) {
        if (other instanceof PalAlgorithm) {
            return PalBoolean.of(this == other);
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
