package com.onelang.compiler.analysis;

import com.onelang.compiler.CompilerException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类型检查失败：携带检查器报告的全部诊断，位置取第一条诊断
 */
public class TypeCheckException extends CompilerException {
    private final List<TypeCheckError> diagnostics;

    public TypeCheckException(List<TypeCheckError> diagnostics) {
        super(describe(diagnostics), diagnostics.isEmpty() ? null : diagnostics.get(0).getLocation());
        this.diagnostics = Collections.unmodifiableList(new ArrayList<TypeCheckError>(diagnostics));
    }

    public List<TypeCheckError> getDiagnostics() {
        return diagnostics;
    }

    private static String describe(List<TypeCheckError> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "Type check failed";
        }
        String first = diagnostics.get(0).getMessage();
        if (diagnostics.size() == 1) {
            return first;
        }
        return first + " (and " + (diagnostics.size() - 1) + " more)";
    }
}
