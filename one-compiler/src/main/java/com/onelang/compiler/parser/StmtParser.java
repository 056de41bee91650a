package com.onelang.compiler.parser;

import com.onelang.compiler.ast.expr.Expression;
import com.onelang.compiler.ast.stmt.*;
import com.onelang.compiler.lexer.SourceLocation;
import com.onelang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.onelang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        parser.skipNewlines();

        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_ENSURE)) {
            return parseEnsureStmt();
        }
        if (parser.check(KW_BREAK)) {
            return new BreakStmt(parser.advance().getLocation());
        }
        if (parser.check(KW_CONTINUE)) {
            return new ContinueStmt(parser.advance().getLocation());
        }

        return parseAssignmentOrExpression();
    }

    /**
     * 代码块有两种互斥形式，由第一个 token 决定：
     * <ul>
     *   <li>{@code { ... }}：解析到匹配的右花括号</li>
     *   <li>缩进隐含：解析到 {@code function}、{@code else}、{@code otherwise}、
     *       外层块的 {@code }} 或输入结束，这些 token 不属于本块</li>
     * </ul>
     */
    Block parseBlock() {
        SourceLocation loc = parser.location();
        List<Statement> statements = new ArrayList<Statement>();

        if (parser.match(LBRACE)) {
            while (!parser.isAtEnd()) {
                parser.skipNewlines();
                if (parser.check(RBRACE) || parser.isAtEnd()) break;
                statements.add(parseStatement());
            }
            parser.expect(RBRACE, "Expected '}' after block");
            return new Block(loc, statements);
        }

        while (!parser.isAtEnd()) {
            parser.skipNewlines();
            if (parser.isAtEnd()) break;
            if (parser.checkAny(KW_FUNCTION, KW_ELSE, KW_OTHERWISE, RBRACE)) break;
            statements.add(parseStatement());
        }
        return new Block(loc, statements);
    }

    Statement parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");

        Expression value = null;
        if (!parser.checkAny(NEWLINE, RBRACE) && !parser.isAtEnd()) {
            value = parser.parseExpression();
        }
        return new ReturnStmt(loc, value);
    }

    Statement parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");

        Expression condition = parser.parseExpression();
        parser.expect(COLON, "Expected ':' after if condition");
        parser.skipNewlines();
        Block thenBlock = parser.parseBlock();

        Block elseBlock = null;
        parser.skipNewlines();
        if (parser.match(KW_ELSE)) {
            parser.expect(COLON, "Expected ':' after else");
            parser.skipNewlines();
            elseBlock = parser.parseBlock();
        }

        return new IfStmt(loc, condition, thenBlock, elseBlock);
    }

    Statement parseEnsureStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_ENSURE, "Expected 'ensure'");

        Expression condition = parser.parseExpression();
        parser.expect(COLON, "Expected ':' after ensure condition");
        parser.skipNewlines();
        Block thenBlock = parser.parseBlock();

        Block otherwiseBlock = null;
        parser.skipNewlines();
        if (parser.match(KW_OTHERWISE)) {
            parser.expect(COLON, "Expected ':' after otherwise");
            parser.skipNewlines();
            otherwiseBlock = parser.parseBlock();
        }

        return new EnsureStmt(loc, condition, thenBlock, otherwiseBlock);
    }

    Statement parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");

        Expression condition = parser.parseExpression();
        parser.expect(COLON, "Expected ':' after while condition");
        parser.skipNewlines();
        Block body = parser.parseBlock();

        return new WhileStmt(loc, condition, body);
    }

    /**
     * 先按表达式解析；若其后紧跟赋值运算符，则把它重新解释为赋值目标
     */
    Statement parseAssignmentOrExpression() {
        SourceLocation loc = parser.location();
        Expression expr = parser.parseExpression();

        if (parser.current.getType().isAssignmentOp()) {
            Token op = parser.advance();
            AssignStmt.AssignOp assignOp;
            switch (op.getType()) {
                case ASSIGN: assignOp = AssignStmt.AssignOp.ASSIGN; break;
                case PLUS_ASSIGN: assignOp = AssignStmt.AssignOp.ADD_ASSIGN; break;
                case MINUS_ASSIGN: assignOp = AssignStmt.AssignOp.SUB_ASSIGN; break;
                case MUL_ASSIGN: assignOp = AssignStmt.AssignOp.MUL_ASSIGN; break;
                case DIV_ASSIGN: assignOp = AssignStmt.AssignOp.DIV_ASSIGN; break;
                default: throw new ParseException("Unexpected assignment operator", op);
            }
            Expression value = parser.parseExpression();
            return new AssignStmt(expr.getLocation(), expr, assignOp, value);
        }

        return new ExpressionStmt(loc, expr);
    }
}
