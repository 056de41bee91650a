package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.expr.Expression;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * If 语句
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBlock;
    private final Block elseBlock;  // 可选（else 分支）

    public IfStmt(SourceLocation location, Expression condition, Block thenBlock, Block elseBlock) {
        super(location);
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
