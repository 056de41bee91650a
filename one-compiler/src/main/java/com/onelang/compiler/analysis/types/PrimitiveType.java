package com.onelang.compiler.analysis.types;

/**
 * 原始类型: Integer, Float, String, Boolean
 */
public final class PrimitiveType extends OneType {

    private final String name;

    public PrimitiveType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isNumeric() {
        return "Integer".equals(name) || "Float".equals(name);
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveType)) return false;
        return name.equals(((PrimitiveType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
