package com.onelang.compiler.bytecode;

import com.onelang.compiler.lexer.SourceLocation;

import java.util.Objects;

/**
 * 字节码指令（不可变）。
 *
 * <p>操作数按 {@link OpCode#getOperandKind()} 解释：常量值、变量名、跳转目标下标、
 * {@link CallTarget} 或个数。代码生成期间跳转指令的操作数可能暂时是未回填的标签。</p>
 */
public final class Instruction {

    private final OpCode opcode;
    private final Object operand;
    private final SourceLocation location;

    public Instruction(OpCode opcode, Object operand, SourceLocation location) {
        this.opcode = opcode;
        this.operand = operand;
        this.location = location;
    }

    public Instruction(OpCode opcode, Object operand) {
        this(opcode, operand, null);
    }

    public Instruction(OpCode opcode) {
        this(opcode, null, null);
    }

    public OpCode getOpcode() { return opcode; }
    public Object getOperand() { return operand; }
    public SourceLocation getLocation() { return location; }

    /** 替换操作数（用于回填跳转目标） */
    public Instruction withOperand(Object newOperand) {
        return new Instruction(opcode, newOperand, location);
    }

    /** 跳转目标下标 */
    public int getJumpTarget() {
        if (!(operand instanceof Integer)) {
            throw new IllegalStateException("Unresolved jump target: " + operand);
        }
        return (Integer) operand;
    }

    public String getName() {
        return (String) operand;
    }

    public CallTarget getCallTarget() {
        return (CallTarget) operand;
    }

    public int getCount() {
        return (Integer) operand;
    }

    /** 跳转指令的目标是否已回填为下标 */
    public boolean isResolved() {
        return !opcode.isJump() || operand instanceof Integer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction that = (Instruction) o;
        return opcode == that.opcode && Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, operand);
    }

    @Override
    public String toString() {
        if (opcode.getOperandKind() == OpCode.OperandKind.NONE) {
            return opcode.name();
        }
        if (opcode.getOperandKind() == OpCode.OperandKind.CONSTANT) {
            return opcode.name() + " " + formatConstant(operand);
        }
        return opcode.name() + " " + operand;
    }

    static String formatConstant(Object value) {
        if (value == null) return "null";
        if (value instanceof String) {
            String s = (String) value;
            return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"")
                    .replace("\n", "\\n").replace("\t", "\\t").replace("\r", "\\r") + '"';
        }
        return String.valueOf(value);
    }
}
