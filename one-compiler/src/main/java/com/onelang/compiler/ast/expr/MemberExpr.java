package com.onelang.compiler.ast.expr;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 成员访问表达式 obj.member
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;

    public MemberExpr(SourceLocation location, Expression target, String member) {
        super(location);
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
