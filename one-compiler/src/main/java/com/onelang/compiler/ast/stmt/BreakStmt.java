package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
