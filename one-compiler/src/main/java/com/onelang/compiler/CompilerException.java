package com.onelang.compiler;

import com.onelang.compiler.lexer.SourceLocation;

/**
 * 编译阶段错误基类。
 *
 * <p>每个阶段（词法、语法、类型检查、代码生成）各有一个子类，
 * 均携带错误描述和源码位置，{@link #getMessage()} 渲染为 {@code name:line:column: message}。</p>
 */
public abstract class CompilerException extends RuntimeException {
    private final String detail;
    private final SourceLocation location;

    protected CompilerException(String detail, SourceLocation location) {
        super(detail);
        this.detail = detail;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    /** 不含位置前缀的错误描述 */
    public String getDetail() {
        return detail;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        return location + ": " + detail;
    }
}
