package com.onelang.compiler.bytecode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 字节码模块：按定义顺序保存函数，外加入口函数名
 */
public final class BytecodeModule {

    public static final String DEFAULT_ENTRY_POINT = "main";

    private final Map<String, CompiledFunction> functions = new LinkedHashMap<String, CompiledFunction>();
    private String entryPoint = DEFAULT_ENTRY_POINT;

    public BytecodeModule() {
    }

    public BytecodeModule(String entryPoint) {
        this.entryPoint = entryPoint;
    }

    /**
     * 添加函数；同名函数被替换并返回旧定义，否则返回 null
     */
    public CompiledFunction addFunction(CompiledFunction function) {
        return functions.put(function.getName(), function);
    }

    public CompiledFunction getFunction(String name) {
        return functions.get(name);
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    public Map<String, CompiledFunction> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    public String getEntryPoint() { return entryPoint; }
    public void setEntryPoint(String entryPoint) { this.entryPoint = entryPoint; }

    /** 入口函数，不存在时返回 null */
    public CompiledFunction getEntryFunction() {
        return functions.get(entryPoint);
    }
}
