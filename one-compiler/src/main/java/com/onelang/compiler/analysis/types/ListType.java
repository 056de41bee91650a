package com.onelang.compiler.analysis.types;

/**
 * 列表类型: List&lt;T&gt;
 */
public final class ListType extends OneType {

    private final OneType elementType;

    public ListType(OneType elementType) {
        this.elementType = elementType;
    }

    public OneType getElementType() {
        return elementType;
    }

    @Override
    public String toDisplayString() {
        return "List<" + elementType.toDisplayString() + ">";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListType)) return false;
        return elementType.equals(((ListType) o).elementType);
    }

    @Override
    public int hashCode() {
        return 31 * elementType.hashCode() + 7;
    }
}
