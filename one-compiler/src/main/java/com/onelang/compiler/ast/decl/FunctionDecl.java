package com.onelang.compiler.ast.decl;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.stmt.Block;
import com.onelang.compiler.lexer.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明
 *
 * <pre>
 * function NAME:
 *   inputs: ...
 *   outputs: ...
 *   requirements: ...
 *   implementation: ...
 * </pre>
 */
public class FunctionDecl extends Declaration {
    private final List<Parameter> inputs;
    private final List<Parameter> outputs;
    private final List<Requirement> requirements;
    private final Block body;

    public FunctionDecl(SourceLocation location, String name, List<Parameter> inputs,
                        List<Parameter> outputs, List<Requirement> requirements, Block body) {
        super(location, name);
        this.inputs = Collections.unmodifiableList(new ArrayList<Parameter>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<Parameter>(outputs));
        this.requirements = Collections.unmodifiableList(new ArrayList<Requirement>(requirements));
        this.body = body;
    }

    public List<Parameter> getInputs() {
        return inputs;
    }

    /** 输出参数；只有第一个决定返回类型 */
    public List<Parameter> getOutputs() {
        return outputs;
    }

    public List<Requirement> getRequirements() {
        return requirements;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
