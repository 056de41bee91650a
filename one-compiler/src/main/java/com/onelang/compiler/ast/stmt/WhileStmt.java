package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.expr.Expression;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * While 语句
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final Block body;

    public WhileStmt(SourceLocation location, Expression condition, Block body) {
        super(location);
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
