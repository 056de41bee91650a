package com.onelang.compiler.lexer;

import com.onelang.compiler.CompilerException;

/**
 * 词法错误
 */
public class LexException extends CompilerException {

    public LexException(String message, SourceLocation location) {
        super(message, location);
    }
}
