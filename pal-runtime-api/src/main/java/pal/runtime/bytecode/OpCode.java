package pal.runtime.bytecode;

/**
 * 指令集
 *
 * <p>数值编码为序号加一（0 保留为无效编码）。每条指令至多带一个操作数，
 * 操作数的含义由 {@link OperandKind} 描述。</p>
 */
public enum OpCode {

    // 常量与字面量
    CONSTANT(OperandKind.CONSTANT),
    TRUE(OperandKind.NONE),
    FALSE(OperandKind.NONE),
    NULL(OperandKind.NONE),

    // 运算
    NEGATE(OperandKind.NONE),
    INVERT(OperandKind.NONE),
    POWER(OperandKind.NONE),
    ADD(OperandKind.NONE),
    SUB(OperandKind.NONE),
    EQUAL(OperandKind.NONE),
    LESS(OperandKind.NONE),
    MORE(OperandKind.NONE),
    MIX(OperandKind.NONE),
    PRINT(OperandKind.NONE),

    // 变量
    GET_GLOBAL(OperandKind.CONSTANT),
    SET_GLOBAL(OperandKind.CONSTANT),
    GET_LOCAL(OperandKind.BYTE),
    SET_LOCAL(OperandKind.BYTE),

    // 控制流
    LOOP(OperandKind.LOOP),
    FALSEY_JUMP(OperandKind.JUMP),
    ALWAYS_JUMP(OperandKind.JUMP),
    ADVANCE(OperandKind.NONE),
    POP(OperandKind.NONE),
    DEF_GLOBAL(OperandKind.CONSTANT),

    // 枚举与数组
    ENUM(OperandKind.CONSTANT),
    GET_FIELD(OperandKind.CONSTANT),
    DEF_FIELD(OperandKind.CONSTANT),
    ARRAY(OperandKind.NONE),
    DEF_ELEM(OperandKind.NONE),

    // 调用
    RETURN(OperandKind.NONE),
    CALL(OperandKind.BYTE),
    YIELD(OperandKind.NONE),
    SLEEP(OperandKind.NONE),

    // 仪器动作
    SCAN(OperandKind.NONE),
    CLUSTER(OperandKind.NONE),
    FILTER(OperandKind.NONE),
    MARK(OperandKind.NONE),
    TIGHTEN(OperandKind.NONE),
    SEARCH(OperandKind.NONE);

    /**
     * 操作数种类
     */
    public enum OperandKind {
        /** 无操作数 */
        NONE,
        /** 常量池索引 */
        CONSTANT,
        /** 局部槽位或参数个数 */
        BYTE,
        /** 向前跳转的相对距离 */
        JUMP,
        /** 向后跳转的相对距离 */
        LOOP
    }

    private static final OpCode[] VALUES = values();

    private final OperandKind operandKind;

    OpCode(OperandKind operandKind) {
        this.operandKind = operandKind;
    }

    public int getCode() {
        return ordinal() + 1;
    }

    public OperandKind getOperandKind() {
        return operandKind;
    }

    public boolean hasOperand() {
        return operandKind != OperandKind.NONE;
    }

    /**
     * 指令总长度（含操作数）
     */
    public int getLength() {
        return hasOperand() ? 2 : 1;
    }

    /**
     * 是否为交给宿主执行的仪器动作
     */
    public boolean isInstrumentAction() {
        return ordinal() >= SCAN.ordinal();
    }

    /**
     * 按数值编码查找
     *
     * @return 未知编码返回 null
     */
    public static OpCode fromCode(int code) {
        if (code < 1 || code > VALUES.length) {
            return null;
        }
        return VALUES[code - 1];
    }
}
