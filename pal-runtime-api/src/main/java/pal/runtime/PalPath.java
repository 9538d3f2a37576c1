package pal.runtime;

/**
 * 文件系统路径值（源码中以单引号书写）
 */
public final class PalPath extends PalValue {

    private final String path;

    private PalPath(String path) {
        this.path = path;
    }

    public static PalPath of(String path) {
        return new PalPath(path);
    }

    public String getPath() {
        return path;
    }

    /**
     * 转换为 {@link java.nio.file.Path}
     */
    public java.nio.file.Path toJavaPath() {
        return java.nio.file.Paths.get(path);
    }

    @Override
    public String getTypeName() {
        return "Path";
    }

    @Override
    public boolean isTruthy() {
        return !path.isEmpty();
    }

    @Override
    public PalValue equal(PalValue other) {
        if (other instanceof PalPath) {
            return PalBoolean.of(path.equals(((PalPath) other).path));
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PalPath && ((PalPath) o).path.equals(path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
