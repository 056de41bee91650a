package com.onelang.compiler.ast.decl;

import com.onelang.compiler.ast.AstNode;
import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 函数需求描述（自由文本，不做校验）
 */
public class Requirement extends AstNode {
    private final String description;

    public Requirement(SourceLocation location, String description) {
        super(location);
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRequirement(this, context);
    }
}
