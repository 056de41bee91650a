package com.onelang.compiler.bytecode;

/**
 * 字节码反汇编（调试输出）
 */
public final class Disassembler {

    private Disassembler() {}

    public static String disassemble(CompiledFunction function) {
        StringBuilder sb = new StringBuilder();
        sb.append("Function ").append(function.getName())
          .append(" (").append(function.getParamCount()).append(" params):");
        for (int i = 0; i < function.size(); i++) {
            sb.append('\n').append(String.format("  %4d: %s", i, function.getInstruction(i)));
        }
        return sb.toString();
    }

    public static String disassemble(BytecodeModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("Bytecode Module:\n");
        sb.append("Entry point: ").append(module.getEntryPoint()).append('\n');
        sb.append('\n');
        for (CompiledFunction function : module.getFunctions().values()) {
            sb.append(disassemble(function)).append('\n');
            sb.append('\n');
        }
        return sb.toString();
    }
}
