package com.onelang.compiler.ast.expr;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 标识符表达式
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
