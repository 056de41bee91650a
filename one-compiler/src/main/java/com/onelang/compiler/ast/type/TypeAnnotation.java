package com.onelang.compiler.ast.type;

import com.onelang.compiler.ast.AstNode;
import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类型注解：名称加可选的泛型参数，如 {@code List<Integer>}
 */
public class TypeAnnotation extends AstNode {
    private final String name;
    private final List<TypeAnnotation> typeArgs;

    public TypeAnnotation(SourceLocation location, String name, List<TypeAnnotation> typeArgs) {
        super(location);
        this.name = name;
        this.typeArgs = Collections.unmodifiableList(new ArrayList<TypeAnnotation>(typeArgs));
    }

    public String getName() {
        return name;
    }

    public List<TypeAnnotation> getTypeArgs() {
        return typeArgs;
    }

    public boolean isGeneric() {
        return !typeArgs.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAnnotation(this, context);
    }

    @Override
    public String toString() {
        if (typeArgs.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i));
        }
        return sb.append('>').toString();
    }
}
