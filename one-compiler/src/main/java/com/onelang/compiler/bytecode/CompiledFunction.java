package com.onelang.compiler.bytecode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译后的函数：参数按名称槽位传递，指令中的跳转目标均已回填
 */
public final class CompiledFunction {

    private final String name;
    private final List<String> paramNames;
    private final List<Instruction> instructions;
    private final List<Object> constants;

    public CompiledFunction(String name, List<String> paramNames,
                            List<Instruction> instructions, List<Object> constants) {
        this.name = name;
        this.paramNames = Collections.unmodifiableList(new ArrayList<String>(paramNames));
        this.instructions = Collections.unmodifiableList(new ArrayList<Instruction>(instructions));
        this.constants = Collections.unmodifiableList(new ArrayList<Object>(constants));
    }

    public String getName() { return name; }
    public List<String> getParamNames() { return paramNames; }
    public int getParamCount() { return paramNames.size(); }
    public List<Instruction> getInstructions() { return instructions; }

    /** LOAD_CONST 使用的常量，按首次出现的顺序去重 */
    public List<Object> getConstants() { return constants; }

    public Instruction getInstruction(int index) {
        return instructions.get(index);
    }

    public int size() {
        return instructions.size();
    }

    @Override
    public String toString() {
        return "CompiledFunction(" + name + ", " + paramNames.size() + " params, "
                + instructions.size() + " instructions)";
    }
}
