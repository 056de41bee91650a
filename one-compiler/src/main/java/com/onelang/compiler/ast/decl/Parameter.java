package com.onelang.compiler.ast.decl;

import com.onelang.compiler.ast.AstNode;
import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.type.TypeAnnotation;
import com.onelang.compiler.lexer.SourceLocation;

/**
 * 函数参数（输入或输出）
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeAnnotation type;  // 可选

    public Parameter(SourceLocation location, String name, TypeAnnotation type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeAnnotation getType() {
        return type;
    }

    public boolean hasType() {
        return type != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
