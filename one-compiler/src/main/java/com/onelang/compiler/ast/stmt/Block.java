package com.onelang.compiler.ast.stmt;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.lexer.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 代码块（花括号形式或缩进隐含形式，解析后不再区分）
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
