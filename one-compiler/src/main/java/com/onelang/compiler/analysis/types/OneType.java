package com.onelang.compiler.analysis.types;

/**
 * 类型检查器使用的结构化类型表示基类。
 *
 * <p>类型集合是封闭的：{@link PrimitiveType}、{@link FunctionType}、
 * {@link ListType}、{@link VoidType}。相等性为结构相等。</p>
 */
public abstract class OneType {

    protected OneType() {
    }

    /** 人类可读的类型名，用于诊断消息 */
    public abstract String toDisplayString();

    public boolean isNumeric() {
        return false;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
