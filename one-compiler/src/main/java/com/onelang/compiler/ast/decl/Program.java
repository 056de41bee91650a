package com.onelang.compiler.ast.decl;

import com.onelang.compiler.ast.AstNode;
import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）
 */
public class Program extends AstNode {
    private final List<Declaration> declarations;

    public Program(SourceLocation location, List<Declaration> declarations) {
        super(location);
        this.declarations = Collections.unmodifiableList(new ArrayList<Declaration>(declarations));
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    /** 按声明顺序返回所有函数声明（同名函数全部保留） */
    public List<FunctionDecl> getFunctions() {
        List<FunctionDecl> functions = new ArrayList<FunctionDecl>();
        for (Declaration decl : declarations) {
            if (decl instanceof FunctionDecl) {
                functions.add((FunctionDecl) decl);
            }
        }
        return functions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
