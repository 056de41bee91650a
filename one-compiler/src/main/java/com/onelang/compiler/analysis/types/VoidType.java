package com.onelang.compiler.analysis.types;

/**
 * Void 类型（单例）：无返回值的函数、未标注的参数、null 字面量
 */
public final class VoidType extends OneType {

    public static final VoidType INSTANCE = new VoidType();

    private VoidType() {
    }

    @Override
    public String toDisplayString() {
        return "Void";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VoidType;
    }

    @Override
    public int hashCode() {
        return VoidType.class.hashCode();
    }
}
