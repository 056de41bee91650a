package com.onelang.compiler.ast.decl;

import com.onelang.compiler.ast.AstNode;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 顶层声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
