package com.onelang.compiler.ast;

import com.onelang.compiler.ast.decl.*;
import com.onelang.compiler.ast.expr.*;
import com.onelang.compiler.ast.stmt.*;
import com.onelang.compiler.ast.type.TypeAnnotation;

/**
 * AST 访问者接口
 *
 * <p>没有默认实现：每个遍历阶段都必须显式处理全部节点类型，
 * 新增节点时编译器会指出所有遗漏的阶段。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitProgram(Program node, C ctx);

    R visitFunctionDecl(FunctionDecl node, C ctx);

    R visitParameter(Parameter node, C ctx);

    R visitRequirement(Requirement node, C ctx);

    R visitTypeAnnotation(TypeAnnotation node, C ctx);

    // ============ 语句 ============

    R visitBlock(Block node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitEnsureStmt(EnsureStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    // ============ 表达式 ============

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitListLiteral(ListLiteral node, C ctx);
}
