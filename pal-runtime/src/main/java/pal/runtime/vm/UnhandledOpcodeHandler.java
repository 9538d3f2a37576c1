package pal.runtime.vm;

import pal.runtime.bytecode.OpCode;

/**
 * 遇到指令集之外的编码（或未绑定的仪器动作）时调用
 */
@FunctionalInterface
public interface UnhandledOpcodeHandler {

    /** 默认：报告运行时错误 */
    UnhandledOpcodeHandler RAISE = code -> {
        OpCode op = OpCode.fromCode(code);
        throw new PalRuntimeException("Unhandled OpCode " + code + (op != null ? " (" + op + ")" : ""));
    };

    void handle(int code);
}
