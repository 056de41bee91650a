package com.onelang.compiler.codegen;

import com.onelang.compiler.CompilerException;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 代码生成错误
 */
public class CodegenException extends CompilerException {

    public CodegenException(String message, SourceLocation location) {
        super(message, location);
    }
}
