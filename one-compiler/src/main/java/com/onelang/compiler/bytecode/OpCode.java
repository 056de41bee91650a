package com.onelang.compiler.bytecode;

/**
 * 栈式字节码操作码。
 *
 * <p>每个操作码声明操作数种类和栈效果（弹出/压入的值个数）。
 * {@link #VARIADIC} 表示弹出个数由操作数给出。</p>
 */
public enum OpCode {
    // 栈与变量
    LOAD_CONST(OperandKind.CONSTANT, 0, 1),
    LOAD_VAR(OperandKind.NAME, 0, 1),
    STORE_VAR(OperandKind.NAME, 1, 0),
    POP(OperandKind.NONE, 1, 0),

    // 算术
    ADD(OperandKind.NONE, 2, 1),
    SUB(OperandKind.NONE, 2, 1),
    MUL(OperandKind.NONE, 2, 1),
    DIV(OperandKind.NONE, 2, 1),
    MOD(OperandKind.NONE, 2, 1),
    POW(OperandKind.NONE, 2, 1),
    NEG(OperandKind.NONE, 1, 1),

    // 比较
    EQ(OperandKind.NONE, 2, 1),
    NE(OperandKind.NONE, 2, 1),
    LT(OperandKind.NONE, 2, 1),
    GT(OperandKind.NONE, 2, 1),
    LE(OperandKind.NONE, 2, 1),
    GE(OperandKind.NONE, 2, 1),

    // 逻辑
    AND(OperandKind.NONE, 2, 1),
    OR(OperandKind.NONE, 2, 1),
    NOT(OperandKind.NONE, 1, 1),

    // 控制流（跳转目标为绝对指令下标）
    JUMP(OperandKind.JUMP_TARGET, 0, 0),
    JUMP_IF_FALSE(OperandKind.JUMP_TARGET, 1, 0),
    JUMP_IF_TRUE(OperandKind.JUMP_TARGET, 1, 0),
    CALL(OperandKind.CALL, OpCode.VARIADIC, 1),
    RETURN(OperandKind.NONE, 1, 0),
    HALT(OperandKind.NONE, 0, 0),

    // 列表
    BUILD_LIST(OperandKind.COUNT, OpCode.VARIADIC, 1),
    INDEX(OperandKind.NONE, 2, 1),

    // 输出内建：弹出栈顶一个值，压入一个 void 值（与其他调用一致）
    PRINT(OperandKind.NONE, 1, 1),
    PRINTLN(OperandKind.NONE, 1, 1);

    /** 弹出个数由操作数决定 */
    public static final int VARIADIC = -1;

    private final OperandKind operandKind;
    private final int pops;
    private final int pushes;

    OpCode(OperandKind operandKind, int pops, int pushes) {
        this.operandKind = operandKind;
        this.pops = pops;
        this.pushes = pushes;
    }

    public OperandKind getOperandKind() { return operandKind; }
    public int getPushes() { return pushes; }

    public boolean isVariadic() {
        return pops == VARIADIC;
    }

    public boolean isJump() {
        return operandKind == OperandKind.JUMP_TARGET;
    }

    /**
     * 给定操作数时的弹出个数
     */
    public int pops(Object operand) {
        if (pops != VARIADIC) {
            return pops;
        }
        if (operand instanceof CallTarget) {
            return ((CallTarget) operand).getArgCount();
        }
        if (operand instanceof Integer) {
            return (Integer) operand;
        }
        throw new IllegalArgumentException(name() + " requires a count operand, got: " + operand);
    }

    /** 净栈深度变化 */
    public int stackEffect(Object operand) {
        return pushes - pops(operand);
    }

    /**
     * 操作数种类
     */
    public enum OperandKind {
        NONE,           // 无操作数
        CONSTANT,       // Long / Double / String / Boolean / null
        NAME,           // 变量名
        JUMP_TARGET,    // 绝对指令下标
        CALL,           // CallTarget
        COUNT           // 元素/参数个数
    }
}
