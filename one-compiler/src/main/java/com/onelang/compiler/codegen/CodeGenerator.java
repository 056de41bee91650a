package com.onelang.compiler.codegen;

import com.onelang.compiler.ast.AstVisitor;
import com.onelang.compiler.ast.decl.*;
import com.onelang.compiler.ast.expr.*;
import com.onelang.compiler.ast.stmt.*;
import com.onelang.compiler.ast.type.TypeAnnotation;
import com.onelang.compiler.bytecode.*;
import com.onelang.compiler.lexer.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 字节码生成器：AST → {@link BytecodeModule}
 *
 * <p>每个函数独立生成一段指令序列。前向跳转先以 {@link Label} 为操作数发出，
 * 标签绑定位置时回填所有引用点；函数生成结束时不允许残留未回填的标签。
 * {@code continue} 和循环回跳的目标在发出时已知，直接使用下标。</p>
 *
 * <p>同名函数后定义者覆盖先定义者。</p>
 */
public final class CodeGenerator implements AstVisitor<Void, Void> {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    private final String entryPoint;
    private final boolean requireEntryPoint;

    private BytecodeModule module;
    private int labelCounter;

    // 当前函数状态
    private List<Instruction> instructions;
    private List<Object> constants;
    private List<Label> labels;
    private final Deque<LoopContext> loopStack = new ArrayDeque<LoopContext>();

    public CodeGenerator() {
        this(BytecodeModule.DEFAULT_ENTRY_POINT, false);
    }

    /**
     * @param entryPoint        写入模块的入口函数名
     * @param requireEntryPoint 为 true 时缺少入口函数视为错误
     */
    public CodeGenerator(String entryPoint, boolean requireEntryPoint) {
        this.entryPoint = entryPoint;
        this.requireEntryPoint = requireEntryPoint;
    }

    /**
     * 生成入口
     *
     * @throws CodegenException break/continue 不在循环内、不支持的运算符、
     *                          非简单名称的调用目标或赋值目标、缺少入口函数
     */
    public BytecodeModule generate(Program program) {
        module = new BytecodeModule(entryPoint);
        program.accept(this, null);
        if (requireEntryPoint && !module.hasFunction(entryPoint)) {
            throw new CodegenException("Missing entry point function: " + entryPoint, program.getLocation());
        }
        return module;
    }

    // ============ 指令发出 ============

    private int emit(OpCode opcode, Object operand, SourceLocation location) {
        instructions.add(new Instruction(opcode, operand, location));
        return instructions.size() - 1;
    }

    private int emit(OpCode opcode, SourceLocation location) {
        return emit(opcode, null, location);
    }

    private void emitConst(Object value, SourceLocation location) {
        boolean known = false;
        for (Object c : constants) {
            if (Objects.equals(c, value)) {
                known = true;
                break;
            }
        }
        if (!known) {
            constants.add(value);
        }
        emit(OpCode.LOAD_CONST, value, location);
    }

    private int currentPosition() {
        return instructions.size();
    }

    // ============ 标签 ============

    private Label newLabel() {
        Label label = new Label(labelCounter++);
        labels.add(label);
        return label;
    }

    /** 发出指向标签的跳转；标签未绑定时记录回填点 */
    private void emitJump(OpCode opcode, Label label, SourceLocation location) {
        if (label.isBound()) {
            emit(opcode, label.getPosition(), location);
            return;
        }
        int site = emit(opcode, label, location);
        label.addPatchSite(site);
    }

    /** 将标签绑定到当前位置并回填所有引用点 */
    private void bindLabel(Label label) {
        int position = currentPosition();
        label.bind(position);
        for (int site : label.getPatchSites()) {
            instructions.set(site, instructions.get(site).withOperand(position));
        }
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, Void ctx) {
        for (FunctionDecl func : node.getFunctions()) {
            func.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, Void ctx) {
        instructions = new ArrayList<Instruction>();
        constants = new ArrayList<Object>();
        labels = new ArrayList<Label>();
        loopStack.clear();

        List<String> paramNames = new ArrayList<String>();
        for (Parameter param : node.getInputs()) {
            paramNames.add(param.getName());
        }

        node.getBody().accept(this, ctx);

        // 隐式返回：末尾不是 RETURN，或有跳转指向末尾之后
        if (needsImplicitReturn()) {
            emitConst(null, node.getLocation());
            emit(OpCode.RETURN, node.getLocation());
        }

        for (Label label : labels) {
            if (!label.isBound()) {
                throw new IllegalStateException("Unpatched label " + label + " in function " + node.getName());
            }
        }
        for (Instruction inst : instructions) {
            if (!inst.isResolved()) {
                throw new IllegalStateException("Unresolved jump in function " + node.getName() + ": " + inst);
            }
        }

        CompiledFunction compiled = new CompiledFunction(node.getName(), paramNames, instructions, constants);
        CompiledFunction previous = module.addFunction(compiled);
        if (previous != null) {
            log.warn("{}: duplicate function '{}' replaces the earlier definition", node.getLocation(), node.getName());
        }
        return null;
    }

    private boolean needsImplicitReturn() {
        if (instructions.isEmpty()) return true;
        if (instructions.get(instructions.size() - 1).getOpcode() != OpCode.RETURN) return true;
        int end = currentPosition();
        for (Label label : labels) {
            if (label.getPosition() == end) return true;
        }
        return false;
    }

    @Override
    public Void visitParameter(Parameter node, Void ctx) {
        return null;
    }

    @Override
    public Void visitRequirement(Requirement node, Void ctx) {
        return null;
    }

    @Override
    public Void visitTypeAnnotation(TypeAnnotation node, Void ctx) {
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, Void ctx) {
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        node.getExpression().accept(this, ctx);
        emit(OpCode.POP, node.getLocation());
        return null;
    }

    /**
     * 复合赋值展开为：右值、读目标、算术指令、写目标
     */
    @Override
    public Void visitAssignStmt(AssignStmt node, Void ctx) {
        if (!node.hasIdentifierTarget()) {
            throw new CodegenException("Cannot assign to this target with '"
                    + node.getOperator().toSourceString() + "': only variables are assignable",
                    node.getTarget().getLocation());
        }
        String name = ((Identifier) node.getTarget()).getName();
        SourceLocation loc = node.getLocation();

        node.getValue().accept(this, ctx);

        if (node.isCompound()) {
            emit(OpCode.LOAD_VAR, name, loc);
            switch (node.getOperator()) {
                case ADD_ASSIGN: emit(OpCode.ADD, loc); break;
                case SUB_ASSIGN: emit(OpCode.SUB, loc); break;
                case MUL_ASSIGN: emit(OpCode.MUL, loc); break;
                case DIV_ASSIGN: emit(OpCode.DIV, loc); break;
                default: break;
            }
        }

        emit(OpCode.STORE_VAR, name, loc);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        if (node.hasValue()) {
            node.getValue().accept(this, ctx);
        } else {
            emitConst(null, node.getLocation());
        }
        emit(OpCode.RETURN, node.getLocation());
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        generateConditional(node.getCondition(), node.getThenBlock(), node.getElseBlock(), node.getLocation());
        return null;
    }

    /** ensure/otherwise 与 if/else 生成相同的指令 */
    @Override
    public Void visitEnsureStmt(EnsureStmt node, Void ctx) {
        generateConditional(node.getCondition(), node.getThenBlock(), node.getElseBlock(), node.getLocation());
        return null;
    }

    private void generateConditional(Expression condition, Block thenBlock, Block elseBlock,
                                     SourceLocation loc) {
        condition.accept(this, null);

        Label elseLabel = newLabel();
        Label endLabel = newLabel();

        emitJump(OpCode.JUMP_IF_FALSE, elseLabel, loc);
        thenBlock.accept(this, null);
        emitJump(OpCode.JUMP, endLabel, loc);

        bindLabel(elseLabel);
        if (elseBlock != null) {
            elseBlock.accept(this, null);
        }
        bindLabel(endLabel);
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        SourceLocation loc = node.getLocation();
        Label endLabel = newLabel();
        int start = currentPosition();

        loopStack.push(new LoopContext(endLabel, start));

        node.getCondition().accept(this, ctx);
        emitJump(OpCode.JUMP_IF_FALSE, endLabel, loc);

        node.getBody().accept(this, ctx);
        emit(OpCode.JUMP, start, loc);

        bindLabel(endLabel);
        loopStack.pop();
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, Void ctx) {
        if (loopStack.isEmpty()) {
            throw new CodegenException("break outside of loop", node.getLocation());
        }
        emitJump(OpCode.JUMP, loopStack.peek().breakLabel, node.getLocation());
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, Void ctx) {
        if (loopStack.isEmpty()) {
            throw new CodegenException("continue outside of loop", node.getLocation());
        }
        emit(OpCode.JUMP, loopStack.peek().continueIndex, node.getLocation());
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        node.getLeft().accept(this, ctx);
        node.getRight().accept(this, ctx);

        OpCode opcode;
        switch (node.getOperator()) {
            case ADD: opcode = OpCode.ADD; break;
            case SUB: opcode = OpCode.SUB; break;
            case MUL: opcode = OpCode.MUL; break;
            case DIV: opcode = OpCode.DIV; break;
            case MOD: opcode = OpCode.MOD; break;
            case POW: opcode = OpCode.POW; break;
            case EQ: opcode = OpCode.EQ; break;
            case NE: opcode = OpCode.NE; break;
            case LT: opcode = OpCode.LT; break;
            case GT: opcode = OpCode.GT; break;
            case LE: opcode = OpCode.LE; break;
            case GE: opcode = OpCode.GE; break;
            case AND: opcode = OpCode.AND; break;
            case OR: opcode = OpCode.OR; break;
            default:
                throw new CodegenException("Unknown binary operator: "
                        + node.getOperator().toSourceString(), node.getLocation());
        }
        emit(opcode, node.getLocation());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
        node.getOperand().accept(this, ctx);

        switch (node.getOperator()) {
            case NEG:
                emit(OpCode.NEG, node.getLocation());
                break;
            case NOT:
                emit(OpCode.NOT, node.getLocation());
                break;
            default:
                throw new CodegenException("Unknown unary operator: "
                        + node.getOperator().toSourceString(), node.getLocation());
        }
        return null;
    }

    /**
     * 实参自左向右求值；print/println 是无操作数的内建指令，只消费栈顶一个值，其余为 CALL
     */
    @Override
    public Void visitCallExpr(CallExpr node, Void ctx) {
        String name = node.getCalleeName();
        if (name == null) {
            throw new CodegenException("Only simple function calls are supported", node.getLocation());
        }

        for (Expression arg : node.getArgs()) {
            arg.accept(this, ctx);
        }

        if ("print".equals(name)) {
            emit(OpCode.PRINT, node.getLocation());
        } else if ("println".equals(name)) {
            emit(OpCode.PRINTLN, node.getLocation());
        } else {
            emit(OpCode.CALL, new CallTarget(name, node.getArgs().size()), node.getLocation());
        }
        return null;
    }

    /** 成员访问没有运行时表示，压入 null */
    @Override
    public Void visitMemberExpr(MemberExpr node, Void ctx) {
        emitConst(null, node.getLocation());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, Void ctx) {
        node.getTarget().accept(this, ctx);
        node.getIndex().accept(this, ctx);
        emit(OpCode.INDEX, node.getLocation());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, Void ctx) {
        emitConst(node.getValue(), node.getLocation());
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, Void ctx) {
        emit(OpCode.LOAD_VAR, node.getName(), node.getLocation());
        return null;
    }

    @Override
    public Void visitListLiteral(ListLiteral node, Void ctx) {
        for (Expression element : node.getElements()) {
            element.accept(this, ctx);
        }
        emit(OpCode.BUILD_LIST, node.getElements().size(), node.getLocation());
        return null;
    }

    /**
     * 循环上下文：break 目标标签与 continue 目标下标
     */
    private static final class LoopContext {
        final Label breakLabel;
        final int continueIndex;

        LoopContext(Label breakLabel, int continueIndex) {
            this.breakLabel = breakLabel;
            this.continueIndex = continueIndex;
        }
    }
}
