package pal.runtime;

import pal.runtime.bytecode.Chunk;

/**
 * 源码函数：名称、参数个数与编译后的 {@link Chunk}
 *
 * <p>顶层脚本同样编译为一个函数，名称为 {@link #SCRIPT_NAME}。</p>
 */
public class PalFunction extends PalValue {

    /** 顶层脚本的帧名 */
    public static final String SCRIPT_NAME = "script";

    private final String name;
    private final int arity;
    private final Chunk chunk;

    public PalFunction(String name, int arity, Chunk chunk) {
        this.name = name;
        this.arity = arity;
        this.chunk = chunk;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public boolean isScript() {
        return SCRIPT_NAME.equals(name);
    }

    @Override
    public String getTypeName() {
        return "Function";
    }

    @Override
    public boolean call(CallContext context, int argCount) {
        checkArity(argCount);
        context.pushFrame(this, context.getStack().size() - argCount - 1);
        return true;
    }

    /**
     * @throws PalException 参数个数不匹配
     */
    protected void checkArity(int argCount) {
        if (argCount != arity) {
            throw PalException.arityMismatch(this, arity, argCount);
        }
    }

    @Override
    public String toString() {
        return isScript() ? "<script>" : "<Function " + name + ">";
    }
}
