package com.onelang.compiler.compiler;

import com.onelang.compiler.bytecode.BytecodeModule;

/**
 * 编译配置
 */
public class CompilerOptions {
    private String entryPoint = BytecodeModule.DEFAULT_ENTRY_POINT;
    private boolean typeCheck = true;
    private boolean failOnTypeErrors = true;
    private boolean requireEntryPoint = false;

    public CompilerOptions() {
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public void setEntryPoint(String entryPoint) {
        this.entryPoint = entryPoint;
    }

    /** 是否运行类型检查阶段 */
    public boolean isTypeCheck() {
        return typeCheck;
    }

    public void setTypeCheck(boolean typeCheck) {
        this.typeCheck = typeCheck;
    }

    /** 类型检查有诊断时是否终止编译；为 false 时只记录日志 */
    public boolean isFailOnTypeErrors() {
        return failOnTypeErrors;
    }

    public void setFailOnTypeErrors(boolean failOnTypeErrors) {
        this.failOnTypeErrors = failOnTypeErrors;
    }

    public boolean isRequireEntryPoint() {
        return requireEntryPoint;
    }

    public void setRequireEntryPoint(boolean requireEntryPoint) {
        this.requireEntryPoint = requireEntryPoint;
    }
}
