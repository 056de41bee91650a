package com.onelang.compiler.parser;

import com.onelang.compiler.ast.decl.Declaration;
import com.onelang.compiler.ast.decl.Program;
import com.onelang.compiler.ast.expr.Expression;
import com.onelang.compiler.ast.stmt.Block;
import com.onelang.compiler.ast.stmt.Statement;
import com.onelang.compiler.ast.type.TypeAnnotation;
import com.onelang.compiler.lexer.SourceLocation;
import com.onelang.compiler.lexer.Token;
import com.onelang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.onelang.compiler.lexer.TokenType.*;

/**
 * One 语法分析器（递归下降，单次失败即终止）
 *
 * <p>声明、类型、语句、表达式的解析分别委托给 {@link DeclParser}、{@link TypeParser}、
 * {@link StmtParser}、{@link ExprParser}。</p>
 */
public class Parser {

    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    /**
     * @param tokens 词法分析结果，必须以 EOF 结尾
     */
    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EOF) {
            throw new IllegalArgumentException("Token sequence must end with EOF");
        }
        this.tokens = new ArrayList<Token>(tokens);
        this.position = 0;
        this.current = this.tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token（不会越过 EOF）
     */
    Token advance() {
        previous = current;
        if (!isAtEnd()) {
            position++;
            current = tokens.get(position);
        }
        return previous;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 将当前的 {@code >>} 拆成两个 {@code >}，用于嵌套泛型 {@code List<List<Integer>>}
     */
    void splitShiftRight() {
        Token shift = current;
        SourceLocation loc = shift.getLocation();
        Token first = new Token(GT, ">", null, loc);
        Token second = new Token(GT, ">", null,
                new SourceLocation(loc.getFile(), loc.getLine(), loc.getColumn() + 1));
        tokens.set(position, first);
        tokens.add(position + 1, second);
        current = first;
    }

    /**
     * 当前 token 的源码位置
     */
    SourceLocation location() {
        return current.getLocation();
    }

    /**
     * 是否到达输入末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 跳过换行
     */
    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    /**
     * 当前 token 不可接受时的统一报错
     */
    ParseException unexpected() {
        if (isAtEnd()) {
            return new ParseException("Unexpected end of input", current);
        }
        return new ParseException("Unexpected token: " + current.getLexeme(), current);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序：{@code Program := Declaration*}
     */
    public Program parse() {
        SourceLocation loc = location();
        skipNewlines();

        List<Declaration> declarations = new ArrayList<Declaration>();
        while (!isAtEnd()) {
            declarations.add(parseDeclaration());
            skipNewlines();
        }

        return new Program(loc, declarations);
    }

    // ============ 解析委托 ============

    Declaration parseDeclaration() { return declParser.parseDeclaration(); }

    TypeAnnotation parseTypeAnnotation() { return typeParser.parseTypeAnnotation(); }

    Statement parseStatement() { return stmtParser.parseStatement(); }
    Block parseBlock() { return stmtParser.parseBlock(); }

    Expression parseExpression() { return exprParser.parseExpression(); }
}
