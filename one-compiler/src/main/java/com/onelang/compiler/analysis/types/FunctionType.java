package com.onelang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数类型: (P1, P2) -> R
 */
public final class FunctionType extends OneType {

    private final List<OneType> paramTypes;
    private final OneType returnType;

    public FunctionType(List<OneType> paramTypes, OneType returnType) {
        this.paramTypes = Collections.unmodifiableList(new ArrayList<OneType>(paramTypes));
        this.returnType = returnType;
    }

    public List<OneType> getParamTypes() {
        return paramTypes;
    }

    public OneType getReturnType() {
        return returnType;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(');
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toDisplayString());
        }
        sb.append(") -> ");
        sb.append(returnType.toDisplayString());
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return paramTypes.equals(that.paramTypes) && returnType.equals(that.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(paramTypes, returnType);
    }
}
