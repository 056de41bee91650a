package com.onelang.compiler.analysis.types;

/**
 * 预定义类型常量和工厂方法。
 */
public final class Types {

    private Types() {}

    public static final PrimitiveType INTEGER = new PrimitiveType("Integer");
    public static final PrimitiveType FLOAT = new PrimitiveType("Float");
    public static final PrimitiveType STRING = new PrimitiveType("String");
    public static final PrimitiveType BOOLEAN = new PrimitiveType("Boolean");
    public static final VoidType VOID = VoidType.INSTANCE;

    /** 创建 List&lt;elem&gt; 类型 */
    public static ListType listOf(OneType elem) {
        return new ListType(elem);
    }

    /**
     * 根据类型名查找原始类型，未知名称返回 null
     */
    public static PrimitiveType fromName(String name) {
        switch (name) {
            case "Integer": return INTEGER;
            case "Float": return FLOAT;
            case "String": return STRING;
            case "Boolean": return BOOLEAN;
            default: return null;
        }
    }
}
