package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstNode;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
