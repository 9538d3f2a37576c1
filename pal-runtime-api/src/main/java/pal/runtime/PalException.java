package pal.runtime;

/**
 * PAL 基础运行时异常（无源位置信息）。
 *
 * <p>{@code pal-runtime} 中的 {@code PalRuntimeException} 继承此类，
 * 并附加逐帧的回溯信息。</p>
 */
public class PalException extends RuntimeException {

    public PalException(String message) {
        super(message);
    }

    public PalException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 参数个数不匹配
     */
    public static PalException arityMismatch(PalValue callee, int expected, int actual) {
        return new PalException(callee + " expected " + expected
                + " argument" + (expected == 1 ? "" : "s") + ", got " + actual);
    }
}
