package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.expr.Expression;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * Return 语句
 */
public class ReturnStmt extends Statement {
    private final Expression value;  // 可选

    public ReturnStmt(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
