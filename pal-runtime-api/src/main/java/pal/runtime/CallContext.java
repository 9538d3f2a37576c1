package pal.runtime;

/**
 * 可调用值与虚拟机之间的调用协议
 */
public interface CallContext {

    /**
     * 当前运行共享的操作数栈
     */
    ValueStack getStack();

    /**
     * 为源码函数压入新的调用帧
     *
     * @param function 被调用函数
     * @param base     帧窗口基址（被调用者所在槽位）
     */
    void pushFrame(PalFunction function, int base);
}
