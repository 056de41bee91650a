package com.onelang.compiler.bytecode;

import java.util.Objects;

/**
 * CALL 指令的操作数：被调函数名与实参个数
 */
public final class CallTarget {

    private final String name;
    private final int argCount;

    public CallTarget(String name, int argCount) {
        this.name = name;
        this.argCount = argCount;
    }

    public String getName() { return name; }
    public int getArgCount() { return argCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallTarget)) return false;
        CallTarget that = (CallTarget) o;
        return argCount == that.argCount && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, argCount);
    }

    @Override
    public String toString() {
        return "(" + name + ", " + argCount + ")";
    }
}
