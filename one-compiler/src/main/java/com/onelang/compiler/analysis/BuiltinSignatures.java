package com.onelang.compiler.analysis;

import com.onelang.compiler.analysis.types.FunctionType;
import com.onelang.compiler.analysis.types.OneType;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.onelang.compiler.analysis.types.Types.*;

/**
 * 执行引擎内置函数的签名表
 *
 * <p>列表由运行时以整数句柄表示，所以列表相关内置函数的参数和返回值均为 Integer。</p>
 */
public final class BuiltinSignatures {

    private static final Map<String, FunctionType> SIGNATURES;

    static {
        Map<String, FunctionType> map = new LinkedHashMap<String, FunctionType>();

        // 输出
        map.put("print", fn(VOID, STRING));
        map.put("println", fn(VOID, STRING));

        // 字符串
        map.put("len", fn(INTEGER, STRING));
        map.put("substr", fn(STRING, STRING, INTEGER, INTEGER));
        map.put("char_at", fn(STRING, STRING, INTEGER));
        map.put("str_concat", fn(STRING, STRING, STRING));
        map.put("str_eq", fn(BOOLEAN, STRING, STRING));
        map.put("str_to_int", fn(INTEGER, STRING));
        map.put("int_to_str", fn(STRING, INTEGER));

        // 字符分类
        map.put("is_digit", fn(BOOLEAN, STRING));
        map.put("is_alpha", fn(BOOLEAN, STRING));
        map.put("is_alnum", fn(BOOLEAN, STRING));

        // 列表句柄
        map.put("list_append", fn(INTEGER, INTEGER, INTEGER));
        map.put("list_get", fn(INTEGER, INTEGER, INTEGER));
        map.put("list_set", fn(INTEGER, INTEGER, INTEGER, INTEGER));

        // 进程
        map.put("exit", fn(VOID, INTEGER));

        SIGNATURES = Collections.unmodifiableMap(map);
    }

    private BuiltinSignatures() {}

    /** 按声明顺序返回全部内置函数签名 */
    public static Map<String, FunctionType> all() {
        return SIGNATURES;
    }

    public static boolean isBuiltin(String name) {
        return SIGNATURES.containsKey(name);
    }

    /** 将全部内置函数绑定到给定环境 */
    public static void registerInto(TypeEnvironment env) {
        for (Map.Entry<String, FunctionType> e : SIGNATURES.entrySet()) {
            env.define(e.getKey(), e.getValue());
        }
    }

    private static FunctionType fn(OneType returnType, OneType... params) {
        return new FunctionType(Arrays.asList(params), returnType);
    }
}
