package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * Continue 语句
 */
public class ContinueStmt extends Statement {

    public ContinueStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContinueStmt(this, context);
    }
}
