package com.onelang.compiler.ast.expr;

import com.onelang.compiler.ast.AstNode;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
