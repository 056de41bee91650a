package com.onelang.compiler.ast.expr;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    /** 被调用者是简单名称时返回该名称，否则返回 null */
    public String getCalleeName() {
        return callee instanceof Identifier ? ((Identifier) callee).getName() : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
