package com.onelang.compiler.compiler;

import com.onelang.compiler.bytecode.BytecodeModule;

/**
 * 编译器统一接口。
 */
public interface OneCompilerApi {

    /**
     * 编译源码为字节码模块。
     *
     * @param source     源码字符串
     * @param sourceName 源名称（用于错误位置）
     * @return 字节码模块
     * @throws com.onelang.compiler.CompilerException 任一阶段失败
     */
    BytecodeModule compile(String source, String sourceName);
}
