package com.onelang.compiler.ast.expr;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 字面量表达式
 *
 * <p>值为 {@code Long}、{@code Double}、{@code String}、{@code Boolean} 或 {@code null}。</p>
 */
public class Literal extends Expression {
    private final Object value;

    public Literal(SourceLocation location, Object value) {
        super(location);
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
