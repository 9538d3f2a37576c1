package pal.runtime.vm;

import pal.runtime.bytecode.OpCode;

/**
 * 仪器动作的宿主绑定（SCAN、CLUSTER、FILTER、MARK、TIGHTEN、SEARCH）
 */
@FunctionalInterface
public interface InstrumentActions {

    /**
     * 执行动作；可以抛出 {@link pal.runtime.PalException} 中止运行
     *
     * @param action {@link OpCode#isInstrumentAction()} 为真的指令
     */
    void perform(OpCode action);
}
