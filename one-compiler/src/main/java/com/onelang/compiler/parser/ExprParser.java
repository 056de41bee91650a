package com.onelang.compiler.parser;

import com.onelang.compiler.ast.expr.*;
import com.onelang.compiler.lexer.SourceLocation;
import com.onelang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.onelang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：or、and、相等、比较、加减、乘除模、一元、幂、后缀、基本表达式。
 * 二元运算左结合，{@code **} 右结合。二元节点的位置取左操作数的位置。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseOrExpr();
    }

    // 逻辑或 or
    private Expression parseOrExpr() {
        Expression left = parseAndExpr();

        while (parser.match(KW_OR)) {
            Expression right = parseAndExpr();
            left = new BinaryExpr(left.getLocation(), left, BinaryExpr.BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 and
    private Expression parseAndExpr() {
        Expression left = parseEqualityExpr();

        while (parser.match(KW_AND)) {
            Expression right = parseEqualityExpr();
            left = new BinaryExpr(left.getLocation(), left, BinaryExpr.BinaryOp.AND, right);
        }

        return left;
    }

    // 相等性 == !=
    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();

        while (parser.checkAny(EQ, NE)) {
            Token op = parser.advance();
            Expression right = parseComparisonExpr();
            BinaryExpr.BinaryOp binOp = op.is(EQ) ? BinaryExpr.BinaryOp.EQ : BinaryExpr.BinaryOp.NE;
            left = new BinaryExpr(left.getLocation(), left, binOp, right);
        }

        return left;
    }

    // 比较 < > <= >=
    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();

        while (parser.current.getType().isComparisonOp()) {
            Token op = parser.advance();
            Expression right = parseAdditiveExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case LT: binOp = BinaryExpr.BinaryOp.LT; break;
                case GT: binOp = BinaryExpr.BinaryOp.GT; break;
                case LE: binOp = BinaryExpr.BinaryOp.LE; break;
                default: binOp = BinaryExpr.BinaryOp.GE; break;
            }
            left = new BinaryExpr(left.getLocation(), left, binOp, right);
        }

        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            Expression right = parseMultiplicativeExpr();
            BinaryExpr.BinaryOp binOp = op.is(PLUS) ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(left.getLocation(), left, binOp, right);
        }

        return left;
    }

    // 乘除模 * / %
    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();

        while (parser.checkAny(MUL, DIV, MOD)) {
            Token op = parser.advance();
            Expression right = parseUnaryExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case MUL: binOp = BinaryExpr.BinaryOp.MUL; break;
                case DIV: binOp = BinaryExpr.BinaryOp.DIV; break;
                default: binOp = BinaryExpr.BinaryOp.MOD; break;
            }
            left = new BinaryExpr(left.getLocation(), left, binOp, right);
        }

        return left;
    }

    // 一元 - not ~
    private Expression parseUnaryExpr() {
        if (parser.checkAny(MINUS, KW_NOT, TILDE)) {
            Token op = parser.advance();
            Expression operand = parseUnaryExpr();
            UnaryExpr.UnaryOp unaryOp;
            switch (op.getType()) {
                case MINUS: unaryOp = UnaryExpr.UnaryOp.NEG; break;
                case KW_NOT: unaryOp = UnaryExpr.UnaryOp.NOT; break;
                default: unaryOp = UnaryExpr.UnaryOp.BIT_NOT; break;
            }
            return new UnaryExpr(op.getLocation(), unaryOp, operand);
        }

        return parsePowerExpr();
    }

    // 幂 **（右结合，右侧允许一元：2 ** -1）
    private Expression parsePowerExpr() {
        Expression base = parsePostfixExpr();

        if (parser.match(POWER)) {
            Expression exponent = parseUnaryExpr();
            return new BinaryExpr(base.getLocation(), base, BinaryExpr.BinaryOp.POW, exponent);
        }

        return base;
    }

    // 后缀：调用、成员访问、索引
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        while (true) {
            if (parser.match(LPAREN)) {
                List<Expression> args = new ArrayList<Expression>();
                if (!parser.check(RPAREN)) {
                    do {
                        args.add(parseExpression());
                    } while (parser.match(COMMA));
                }
                parser.expect(RPAREN, "Expected ')' after arguments");
                expr = new CallExpr(expr.getLocation(), expr, args);
            } else if (parser.match(DOT)) {
                Token member = parser.expect(IDENTIFIER, "Expected member name");
                expr = new MemberExpr(expr.getLocation(), expr, member.getLexeme());
            } else if (parser.match(LBRACKET)) {
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(expr.getLocation(), expr, index);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();

        // 字面量
        if (parser.checkAny(KW_TRUE, KW_FALSE, KW_NULL, INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL)) {
            return new Literal(loc, parser.advance().getLiteral());
        }

        // 标识符
        if (parser.check(IDENTIFIER)) {
            return new Identifier(loc, parser.advance().getLexeme());
        }

        // 括号表达式
        if (parser.match(LPAREN)) {
            Expression expr = parseExpression();
            parser.expect(RPAREN, "Expected ')' after expression");
            return expr;
        }

        // 列表字面量
        if (parser.match(LBRACKET)) {
            List<Expression> elements = new ArrayList<Expression>();
            if (!parser.check(RBRACKET)) {
                do {
                    elements.add(parseExpression());
                } while (parser.match(COMMA));
            }
            parser.expect(RBRACKET, "Expected ']' after list elements");
            return new ListLiteral(loc, elements);
        }

        throw parser.unexpected();
    }
}
