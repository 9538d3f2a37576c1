package pal.runtime.bytecode;

import pal.runtime.PalFunction;
import pal.runtime.PalGenerator;
import pal.runtime.PalString;
import pal.runtime.PalValue;

/**
 * 字节码反汇编
 *
 * <p>每行格式：偏移、行号（与上一条相同时为 {@code |}）、指令名、操作数。</p>
 */
public final class Disassembler {

    private Disassembler() {
    }

    /**
     * 反汇编函数及其常量池中嵌套的函数与生成器
     */
    public static String disassemble(PalFunction function) {
        StringBuilder sb = new StringBuilder();
        appendFunction(sb, function.getName(), function.getChunk());
        return sb.toString();
    }

    /**
     * 反汇编单个块
     */
    public static String disassemble(Chunk chunk, String name) {
        StringBuilder sb = new StringBuilder();
        appendFunction(sb, name, chunk);
        return sb.toString();
    }

    private static void appendFunction(StringBuilder sb, String name, Chunk chunk) {
        sb.append("== ").append(name).append(" ==\n");
        int offset = 0;
        while (offset < chunk.size()) {
            offset = instruction(chunk, offset, sb);
            sb.append('\n');
        }
        for (PalValue constant : chunk.getConstants()) {
            if (constant instanceof PalFunction) {
                PalFunction nested = (PalFunction) constant;
                appendFunction(sb, nested.getName(), nested.getChunk());
            } else if (constant instanceof PalGenerator) {
                PalGenerator nested = (PalGenerator) constant;
                appendFunction(sb, nested.getName(), nested.getChunk());
            }
        }
    }

    /**
     * 反汇编单条指令（不含换行）
     *
     * @return 下一条指令的偏移
     */
    public static int instruction(Chunk chunk, int offset, StringBuilder sb) {
        sb.append(String.format("%04d ", offset));
        if (offset > 0 && chunk.getLine(offset) == chunk.getLine(offset - 1)) {
            sb.append("   | ");
        } else {
            sb.append(String.format("%4d ", chunk.getLine(offset)));
        }

        int code = chunk.get(offset);
        OpCode op = OpCode.fromCode(code);
        if (op == null) {
            sb.append("Unknown opcode ").append(code);
            return offset + 1;
        }
        if (!op.hasOperand()) {
            sb.append(op.name());
            return offset + 1;
        }
        if (offset + 1 >= chunk.size()) {
            sb.append(op.name()).append(" <missing operand>");
            return offset + 1;
        }

        int operand = chunk.get(offset + 1);
        sb.append(String.format("%-16s %4d", op.name(), operand));
        switch (op.getOperandKind()) {
            case CONSTANT:
                sb.append(" '").append(describeConstant(chunk, operand)).append('\'');
                break;
            case JUMP:
                sb.append(" -> ").append(offset + 2 + operand);
                break;
            case LOOP:
                sb.append(" -> ").append(offset + 2 - operand);
                break;
            default:
                break;
        }
        return offset + 2;
    }

    private static String describeConstant(Chunk chunk, int index) {
        if (index < 0 || index >= chunk.getConstantCount()) {
            return "<bad constant>";
        }
        PalValue value = chunk.getConstant(index);
        return value instanceof PalString ? ((PalString) value).getValue() : String.valueOf(value);
    }
}
