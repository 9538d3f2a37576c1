package pal.runtime;

/**
 * PAL 运行时值的基类
 *
 * <p>所有值都实现同一套运算协议。运算方法返回 {@code null} 表示"拒绝"，
 * 由 {@link BinaryOperator} 决定是否尝试右操作数的镜像方法。</p>
 */
public abstract class PalValue {

    /**
     * 获取类型名（用于错误信息）
     */
    public abstract String getTypeName();

    /**
     * 真值判断，默认为真
     */
    public boolean isTruthy() {
        return true;
    }

    /**
     * 调用此值
     *
     * @param context  调用上下文（虚拟机）
     * @param argCount 参数个数，被调用者位于参数窗口下方
     * @return 不可调用时返回 false
     */
    public boolean call(CallContext context, int argCount) {
        return false;
    }

    // ============ 一元运算 ============

    public PalValue negate() {
        return null;
    }

    public PalValue invert() {
        return null;
    }

    // ============ 二元运算（左操作数） ============

    public PalValue add(PalValue other) {
        return null;
    }

    public PalValue sub(PalValue other) {
        return null;
    }

    public PalValue power(PalValue other) {
        return null;
    }

    public PalValue mix(PalValue other) {
        return null;
    }

    public PalValue equal(PalValue other) {
        return null;
    }

    public PalValue less(PalValue other) {
        return null;
    }

    public PalValue more(PalValue other) {
        return null;
    }

    // ============ 二元运算（右操作数镜像，other 为左操作数） ============

    public PalValue rAdd(PalValue other) {
        return null;
    }

    public PalValue rSub(PalValue other) {
        return null;
    }

    public PalValue rPower(PalValue other) {
        return null;
    }

    public PalValue rMix(PalValue other) {
        return null;
    }
}
