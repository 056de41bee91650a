package com.onelang.compiler.analysis;

import com.onelang.compiler.analysis.types.*;
import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.decl.*;
import com.onelang.compiler.ast.expr.*;
import com.onelang.compiler.ast.stmt.*;
import com.onelang.compiler.ast.type.TypeAnnotation;
import com.onelang.compiler.lexer.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类型检查器：两遍遍历 AST，推断表达式类型并收集诊断。
 *
 * <p>第一遍把所有函数签名注册到全局环境（因此函数可以前向引用），
 * 第二遍在全局环境的子环境中检查每个函数体。检查是宽松的：
 * 唯一的诊断是引用了未绑定的名称，其余情况都按固定规则退化为某个类型。</p>
 *
 * <p>对用户程序从不抛异常；同一棵 AST 检查多次得到相同的诊断，AST 不会被修改。</p>
 */
public final class TypeChecker implements AstVisitor<OneType, Void> {

    private TypeEnvironment globalEnv;
    private TypeEnvironment currentEnv;
    private final List<TypeCheckError> diagnostics = new ArrayList<TypeCheckError>();

    public TypeChecker() {
        resetEnvironment();
    }

    /**
     * 检查入口
     *
     * @return 没有诊断时为 true
     */
    public boolean check(Program program) {
        resetEnvironment();
        diagnostics.clear();
        program.accept(this, null);
        return diagnostics.isEmpty();
    }

    /** 最近一次 {@link #check} 的诊断 */
    public List<TypeCheckError> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /** 全局环境（内置函数 + 已注册的函数签名） */
    public TypeEnvironment getGlobalEnvironment() {
        return globalEnv;
    }

    /**
     * 在给定环境中推断单个表达式的类型，诊断追加到 {@link #getDiagnostics()}
     */
    public OneType inferType(Expression expr, TypeEnvironment env) {
        TypeEnvironment saved = currentEnv;
        currentEnv = env;
        try {
            return expr.accept(this, null);
        } finally {
            currentEnv = saved;
        }
    }

    private void resetEnvironment() {
        globalEnv = new TypeEnvironment(null);
        BuiltinSignatures.registerInto(globalEnv);
        currentEnv = globalEnv;
    }

    // ============ 作用域管理 ============

    private void enterScope() {
        currentEnv = currentEnv.child();
    }

    private void exitScope() {
        currentEnv = currentEnv.getParent();
    }

    private void error(String message, SourceLocation location) {
        diagnostics.add(new TypeCheckError(message, location));
    }

    // ============ 类型注解解析 ============

    /**
     * 注解到类型：缺省为 Void，未知名称按 Integer 处理，
     * {@code List<T>} 为列表类型（无类型实参时为 {@code List<Integer>}）
     */
    OneType resolveAnnotation(TypeAnnotation annotation) {
        if (annotation == null) {
            return Types.VOID;
        }
        PrimitiveType primitive = Types.fromName(annotation.getName());
        if (primitive != null) {
            return primitive;
        }
        if ("List".equals(annotation.getName())) {
            if (annotation.getTypeArgs().isEmpty()) {
                return Types.listOf(Types.INTEGER);
            }
            return Types.listOf(resolveAnnotation(annotation.getTypeArgs().get(0)));
        }
        return Types.INTEGER;
    }

    private FunctionType signatureOf(FunctionDecl func) {
        List<OneType> paramTypes = new ArrayList<OneType>();
        for (Parameter param : func.getInputs()) {
            paramTypes.add(resolveAnnotation(param.getType()));
        }
        OneType returnType = func.getOutputs().isEmpty()
                ? Types.VOID
                : resolveAnnotation(func.getOutputs().get(0).getType());
        return new FunctionType(paramTypes, returnType);
    }

    // ============ 声明 ============

    @Override
    public OneType visitProgram(Program node, Void ctx) {
        // 第一遍：注册函数签名
        for (FunctionDecl func : node.getFunctions()) {
            globalEnv.define(func.getName(), signatureOf(func));
        }

        // 第二遍：检查函数体
        for (FunctionDecl func : node.getFunctions()) {
            func.accept(this, ctx);
        }
        return Types.VOID;
    }

    @Override
    public OneType visitFunctionDecl(FunctionDecl node, Void ctx) {
        currentEnv = globalEnv.child();
        for (Parameter param : node.getInputs()) {
            param.accept(this, ctx);
        }
        node.getBody().accept(this, ctx);
        currentEnv = globalEnv;
        return Types.VOID;
    }

    @Override
    public OneType visitParameter(Parameter node, Void ctx) {
        OneType type = resolveAnnotation(node.getType());
        currentEnv.define(node.getName(), type);
        return type;
    }

    @Override
    public OneType visitRequirement(Requirement node, Void ctx) {
        return Types.VOID;
    }

    @Override
    public OneType visitTypeAnnotation(TypeAnnotation node, Void ctx) {
        return resolveAnnotation(node);
    }

    // ============ 语句 ============

    /** 块本身不开作用域，返回最后一条语句的类型 */
    @Override
    public OneType visitBlock(Block node, Void ctx) {
        OneType last = Types.VOID;
        for (Statement stmt : node.getStatements()) {
            last = stmt.accept(this, ctx);
        }
        return last;
    }

    @Override
    public OneType visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return node.getExpression().accept(this, ctx);
    }

    @Override
    public OneType visitAssignStmt(AssignStmt node, Void ctx) {
        OneType valueType = node.getValue().accept(this, ctx);

        if (node.hasIdentifierTarget()) {
            String name = ((Identifier) node.getTarget()).getName();
            // 复合赋值会读取目标
            if (node.isCompound()) {
                node.getTarget().accept(this, ctx);
            }
            currentEnv.define(name, valueType);
        } else {
            node.getTarget().accept(this, ctx);
        }
        return valueType;
    }

    @Override
    public OneType visitReturnStmt(ReturnStmt node, Void ctx) {
        if (node.hasValue()) {
            return node.getValue().accept(this, ctx);
        }
        return Types.VOID;
    }

    @Override
    public OneType visitIfStmt(IfStmt node, Void ctx) {
        checkBranches(node.getCondition(), node.getThenBlock(), node.getElseBlock(), ctx);
        return Types.VOID;
    }

    @Override
    public OneType visitEnsureStmt(EnsureStmt node, Void ctx) {
        checkBranches(node.getCondition(), node.getThenBlock(), node.getElseBlock(), ctx);
        return Types.VOID;
    }

    private void checkBranches(Expression condition, Block thenBlock, Block elseBlock, Void ctx) {
        // 条件不要求是 Boolean
        condition.accept(this, ctx);

        enterScope();
        thenBlock.accept(this, ctx);
        exitScope();

        if (elseBlock != null) {
            enterScope();
            elseBlock.accept(this, ctx);
            exitScope();
        }
    }

    @Override
    public OneType visitWhileStmt(WhileStmt node, Void ctx) {
        node.getCondition().accept(this, ctx);

        enterScope();
        node.getBody().accept(this, ctx);
        exitScope();
        return Types.VOID;
    }

    @Override
    public OneType visitBreakStmt(BreakStmt node, Void ctx) {
        return Types.VOID;
    }

    @Override
    public OneType visitContinueStmt(ContinueStmt node, Void ctx) {
        return Types.VOID;
    }

    // ============ 表达式 ============

    @Override
    public OneType visitBinaryExpr(BinaryExpr node, Void ctx) {
        OneType left = node.getLeft().accept(this, ctx);
        OneType right = node.getRight().accept(this, ctx);

        if (node.getOperator().isArithmetic()) {
            if (left.isNumeric() && right.isNumeric()) {
                if (Types.FLOAT.equals(left) || Types.FLOAT.equals(right)) {
                    return Types.FLOAT;
                }
                return Types.INTEGER;
            }
            return Types.INTEGER;
        }
        return Types.BOOLEAN;
    }

    @Override
    public OneType visitUnaryExpr(UnaryExpr node, Void ctx) {
        OneType operand = node.getOperand().accept(this, ctx);
        switch (node.getOperator()) {
            case NEG: return operand;
            case NOT: return Types.BOOLEAN;
            default: return Types.INTEGER;
        }
    }

    @Override
    public OneType visitCallExpr(CallExpr node, Void ctx) {
        OneType callee = node.getCallee().accept(this, ctx);
        for (Expression arg : node.getArgs()) {
            arg.accept(this, ctx);
        }
        if (callee instanceof FunctionType) {
            return ((FunctionType) callee).getReturnType();
        }
        return Types.VOID;
    }

    @Override
    public OneType visitMemberExpr(MemberExpr node, Void ctx) {
        node.getTarget().accept(this, ctx);
        return Types.INTEGER;
    }

    @Override
    public OneType visitIndexExpr(IndexExpr node, Void ctx) {
        OneType target = node.getTarget().accept(this, ctx);
        node.getIndex().accept(this, ctx);
        if (target instanceof ListType) {
            return ((ListType) target).getElementType();
        }
        return Types.INTEGER;
    }

    @Override
    public OneType visitLiteral(Literal node, Void ctx) {
        Object value = node.getValue();
        if (value instanceof Long) return Types.INTEGER;
        if (value instanceof Double) return Types.FLOAT;
        if (value instanceof String) return Types.STRING;
        if (value instanceof Boolean) return Types.BOOLEAN;
        return Types.VOID;
    }

    @Override
    public OneType visitIdentifier(Identifier node, Void ctx) {
        OneType type = currentEnv.lookup(node.getName());
        if (type == null) {
            error("Undefined variable: " + node.getName(), node.getLocation());
            return Types.INTEGER;
        }
        return type;
    }

    @Override
    public OneType visitListLiteral(ListLiteral node, Void ctx) {
        if (node.getElements().isEmpty()) {
            return Types.listOf(Types.INTEGER);
        }
        OneType first = node.getElements().get(0).accept(this, ctx);
        for (int i = 1; i < node.getElements().size(); i++) {
            node.getElements().get(i).accept(this, ctx);
        }
        return Types.listOf(first);
    }
}
