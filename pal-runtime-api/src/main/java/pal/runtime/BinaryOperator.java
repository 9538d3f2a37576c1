package pal.runtime;

/**
 * 二元运算分派表
 *
 * <p>先调用左操作数的方法；左操作数拒绝时调用右操作数的镜像方法。
 * 两者都拒绝时 {@link #apply} 返回 {@code null}，由调用方报告类型错误。</p>
 */
public enum BinaryOperator {

    ADD("add") {
        @Override
        PalValue left(PalValue l, PalValue r) { return l.add(r); }
        @Override
        PalValue mirrored(PalValue l, PalValue r) { return r.rAdd(l); }
    },
    SUB("sub") {
        @Override
        PalValue left(PalValue l, PalValue r) { return l.sub(r); }
        @Override
        PalValue mirrored(PalValue l, PalValue r) { return r.rSub(l); }
    },
    POWER("power") {
        @Override
        PalValue left(PalValue l, PalValue r) { return l.power(r); }
        @Override
        PalValue mirrored(PalValue l, PalValue r) { return r.rPower(l); }
    },
    MIX("mix") {
        @Override
        PalValue left(PalValue l, PalValue r) { return l.mix(r); }
        @Override
        PalValue mirrored(PalValue l, PalValue r) { return r.rMix(l); }
    },
    EQUAL("equal") {
        @Override
        PalValue left(PalValue l, PalValue r) { return l.equal(r); }
        @Override
        PalValue mirrored(PalValue l, PalValue r) { return r.equal(l); }
    },
    LESS("less") {
        @Override
        PalValue left(PalValue l, PalValue r) { return l.less(r); }
        @Override
        PalValue mirrored(PalValue l, PalValue r) { return r.more(l); }
    },
    MORE("more") {
        @Override
        PalValue left(PalValue l, PalValue r) { return l.more(r); }
        @Override
        PalValue mirrored(PalValue l, PalValue r) { return r.less(l); }
    };

    private final String methodName;

    BinaryOperator(String methodName) {
        this.methodName = methodName;
    }

    abstract PalValue left(PalValue l, PalValue r);

    abstract PalValue mirrored(PalValue l, PalValue r);

    /**
     * 运算名（用于错误信息）
     */
    public String getMethodName() {
        return methodName;
    }

    /**
     * 执行运算
     *
     * @return 运算结果；两个操作数都拒绝时返回 {@code null}
     */
    public PalValue apply(PalValue left, PalValue right) {
        PalValue result = left(left, right);
        if (result == null) {
            result = mirrored(left, right);
        }
        return result;
    }

    /**
     * 执行运算，两个操作数都拒绝时抛出异常
     *
     * @throws PalException 操作数类型不受支持
     */
    public PalValue applyOrThrow(PalValue left, PalValue right) {
        PalValue result = apply(left, right);
        if (result == null) {
            throw new PalException("Unsupported operands for " + methodName + ": '"
                    + left.getTypeName() + "' and '" + right.getTypeName() + "'");
        }
        return result;
    }
}
