package pal.runtime;

import java.util.List;

/**
 * 宿主函数
 */
public final class PalNativeFunction extends PalValue {

    /** 不限参数个数 */
    public static final int VARIADIC = -1;

    /**
     * 宿主回调
     */
    @FunctionalInterface
    public interface NativeBody {
        /**
         * @param args 参数列表（不含被调用者）
         * @return 结果值；null 视为 {@link PalNil#NIL}
         */
        PalValue invoke(List<PalValue> args);
    }

    private final String name;
    private final int arity;
    private final NativeBody body;

    public PalNativeFunction(String name, int arity, NativeBody body) {
        this.name = name;
        this.arity = arity;
        this.body = body;
    }

    public PalNativeFunction(String name, NativeBody body) {
        this(name, VARIADIC, body);
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    @Override
    public String getTypeName() {
        return "NativeFunction";
    }

    @Override
    public boolean call(CallContext context, int argCount) {
        if (arity != VARIADIC && argCount != arity) {
            throw PalException.arityMismatch(this, arity, argCount);
        }
        ValueStack stack = context.getStack();
        int base = stack.size() - argCount - 1;
        List<PalValue> args = stack.sliceFrom(base + 1);
        PalValue result;
        try {
            result = body.invoke(args);
        } catch (PalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PalException("Native function '" + name + "' failed: " + e.getMessage(), e);
        }
        stack.truncate(base);
        stack.push(result != null ? result : PalNil.NIL);
        return true;
    }

    @Override
    public String toString() {
        return "<NativeFunction " + name + ">";
    }
}
