package com.onelang.compiler.analysis;

import com.onelang.compiler.analysis.types.OneType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 类型环境：名称到类型的作用域链
 */
public final class TypeEnvironment {

    private final TypeEnvironment parent;
    private final Map<String, OneType> bindings = new LinkedHashMap<String, OneType>();

    public TypeEnvironment(TypeEnvironment parent) {
        this.parent = parent;
    }

    public TypeEnvironment getParent() { return parent; }

    /** 在当前作用域绑定（覆盖同名） */
    public void define(String name, OneType type) {
        bindings.put(name, type);
    }

    /** 从当前作用域向上查找，找不到返回 null */
    public OneType lookup(String name) {
        OneType t = bindings.get(name);
        if (t != null) return t;
        if (parent != null) return parent.lookup(name);
        return null;
    }

    /** 创建以当前环境为父级的子作用域 */
    public TypeEnvironment child() {
        return new TypeEnvironment(this);
    }
}
