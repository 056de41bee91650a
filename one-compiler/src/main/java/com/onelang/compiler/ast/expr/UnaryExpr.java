package com.onelang.compiler.ast.expr;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        NOT("not"),
        BIT_NOT("~");   // 可解析，但没有对应的字节码

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
