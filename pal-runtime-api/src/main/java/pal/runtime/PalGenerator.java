package pal.runtime;

import pal.runtime.bytecode.Chunk;

/**
 * 生成器：函数加上可选的挂起帧
 *
 * <p>声明得到的生成器没有挂起帧；调用时复制出一个预备好的实例，
 * 其挂起帧为被调用者与参数窗口，随后压入包装它的 {@link PalIterator}。</p>
 */
public final class PalGenerator extends PalValue {

    private final PalFunction function;
    private SavedFrame savedFrame;

    public PalGenerator(PalFunction function) {
        this(function, null);
    }

    private PalGenerator(PalFunction function, SavedFrame savedFrame) {
        this.function = function;
        this.savedFrame = savedFrame;
    }

    public PalFunction getFunction() {
        return function;
    }

    public String getName() {
        return function.getName();
    }

    public int getArity() {
        return function.getArity();
    }

    public Chunk getChunk() {
        return function.getChunk();
    }

    public SavedFrame getSavedFrame() {
        return savedFrame;
    }

    /**
     * 挂起：保存帧窗口与恢复位置
     */
    public void save(SavedFrame frame) {
        this.savedFrame = frame;
    }

    @Override
    public String getTypeName() {
        return "Generator";
    }

    @Override
    public boolean call(CallContext context, int argCount) {
        if (argCount != function.getArity()) {
            throw PalException.arityMismatch(this, function.getArity(), argCount);
        }
        ValueStack stack = context.getStack();
        int base = stack.size() - argCount - 1;
        PalGenerator primed = new PalGenerator(function, new SavedFrame(stack.sliceFrom(base), 0));
        stack.truncate(base);
        stack.push(new PalIterator(primed));
        return true;
    }

    @Override
    public String toString() {
        return "<Generator " + function.getName() + ">";
    }
}
