package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.expr.Expression;
import com.onelang.compiler.ast.expr.Identifier;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 赋值语句
 *
 * <p>语法上目标可以是任意表达式；只有标识符目标可以生成代码。</p>
 */
public class AssignStmt extends Statement {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignStmt(SourceLocation location, Expression target, AssignOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isCompound() {
        return operator != AssignOp.ASSIGN;
    }

    public boolean hasIdentifierTarget() {
        return target instanceof Identifier;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }

    /**
     * 赋值运算符
     */
    public enum AssignOp {
        ASSIGN("="),
        ADD_ASSIGN("+="),
        SUB_ASSIGN("-="),
        MUL_ASSIGN("*="),
        DIV_ASSIGN("/=");

        private final String source;

        AssignOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
