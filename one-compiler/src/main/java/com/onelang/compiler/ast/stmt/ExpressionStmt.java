package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.expr.Expression;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 表达式语句
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
