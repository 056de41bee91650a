package com.onelang.compiler.ast.expr;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 索引访问表达式 target[index]
 */
public class IndexExpr extends Expression {
    private final Expression target;
    private final Expression index;

    public IndexExpr(SourceLocation location, Expression target, Expression index) {
        super(location);
        this.target = target;
        this.index = index;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
