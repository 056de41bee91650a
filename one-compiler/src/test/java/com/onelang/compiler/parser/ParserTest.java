package com.onelang.compiler.parser;

import com.onelang.compiler.ast.decl.*;
import com.onelang.compiler.ast.expr.*;
import com.onelang.compiler.ast.stmt.*;
import com.onelang.compiler.ast.type.TypeAnnotation;
import com.onelang.compiler.lexer.Lexer;
import com.onelang.compiler.lexer.SourceLocation;
import com.onelang.compiler.lexer.Token;
import com.onelang.compiler.lexer.TokenType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private static final String ADD_SOURCE =
            "function add:\n" +
            "  inputs:\n" +
            "    a: Integer\n" +
            "    b: Integer\n" +
            "  outputs:\n" +
            "    result: Integer\n" +
            "  implementation:\n" +
            "    return a + b\n";

    private Program parse(String source) {
        return new Parser(new Lexer(source, "<test>").scanTokens()).parse();
    }

    /** 把语句放进 main 的实现体中解析，返回函数体 */
    private Block body(String statements) {
        Program program = parse("function main:\n  implementation:\n" + statements);
        return program.getFunctions().get(0).getBody();
    }

    private Statement firstStatement(String statements) {
        return body(statements).getStatements().get(0);
    }

    /** 解析 return 后的表达式 */
    private Expression expr(String source) {
        ReturnStmt ret = (ReturnStmt) firstStatement("    return " + source + "\n");
        return ret.getValue();
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    private long intValue(Expression e) {
        return (Long) ((Literal) e).getValue();
    }

    // ============ 程序与函数声明 ============

    @Nested
    @DisplayName("函数声明")
    class FunctionDeclarationTests {

        @Test
        @DisplayName("完整的 add 函数")
        void testAddFunction() {
            Program program = parse(ADD_SOURCE);
            assertEquals(1, program.getDeclarations().size());

            FunctionDecl fn = program.getFunctions().get(0);
            assertEquals("add", fn.getName());
            assertEquals(2, fn.getInputs().size());
            assertEquals("a", fn.getInputs().get(0).getName());
            assertEquals("Integer", fn.getInputs().get(0).getType().getName());
            assertEquals("b", fn.getInputs().get(1).getName());
            assertEquals(1, fn.getOutputs().size());
            assertEquals("result", fn.getOutputs().get(0).getName());
            assertTrue(fn.getRequirements().isEmpty());

            assertEquals(1, fn.getBody().getStatements().size());
            ReturnStmt ret = (ReturnStmt) fn.getBody().getStatements().get(0);
            BinaryExpr sum = (BinaryExpr) ret.getValue();
            assertEquals(BinaryExpr.BinaryOp.ADD, sum.getOperator());
        }

        @Test
        @DisplayName("空程序")
        void testEmptyProgram() {
            assertTrue(parse("").getDeclarations().isEmpty());
            assertTrue(parse("\n\n\n").getDeclarations().isEmpty());
        }

        @Test
        @DisplayName("只有 implementation 的函数")
        void testImplementationOnly() {
            FunctionDecl fn = parse("function main:\n  implementation:\n    println(\"hi\")\n").getFunctions().get(0);
            assertTrue(fn.getInputs().isEmpty());
            assertTrue(fn.getOutputs().isEmpty());
            assertEquals(1, fn.getBody().getStatements().size());
        }

        @Test
        @DisplayName("缩进块在下一个 function 处结束")
        void testTwoFunctions() {
            Program program = parse(
                    "function first:\n  implementation:\n    x = 1\n    y = 2\n\n" +
                    "function second:\n  implementation:\n    return 3\n");
            assertEquals(2, program.getFunctions().size());
            assertEquals(2, program.getFunctions().get(0).getBody().getStatements().size());
            assertEquals("second", program.getFunctions().get(1).getName());
        }

        @Test
        @DisplayName("同名函数全部保留")
        void testDuplicateFunctionsRetained() {
            Program program = parse(
                    "function f:\n  implementation:\n    return 1\n" +
                    "function f:\n  implementation:\n    return 2\n");
            assertEquals(2, program.getFunctions().size());
        }

        @Test
        @DisplayName("参数列表中的空行")
        void testBlankLinesInParams() {
            FunctionDecl fn = parse(
                    "function f:\n  inputs:\n    a\n\n    b\n  implementation:\n    return a\n").getFunctions().get(0);
            assertEquals(2, fn.getInputs().size());
            assertFalse(fn.getInputs().get(0).hasType());
        }

        @Test
        @DisplayName("requirements 条目以空格拼接")
        void testRequirements() {
            FunctionDecl fn = parse(
                    "function f:\n" +
                    "  inputs:\n    x: Integer\n" +
                    "  requirements:\n" +
                    "    - x must be positive\n" +
                    "    - x > 0\n" +
                    "  implementation:\n    return x\n").getFunctions().get(0);
            assertEquals(2, fn.getRequirements().size());
            assertEquals("x must be positive", fn.getRequirements().get(0).getDescription());
            assertEquals("x > 0", fn.getRequirements().get(1).getDescription());
            assertEquals(5, fn.getRequirements().get(0).getLocation().getColumn());
        }

        @Test
        @DisplayName("requirements 条目缺少 '-' 报错")
        void testRequirementWithoutDash() {
            ParseException e = parseError(
                    "function f:\n  requirements:\n    x > 0\n  implementation:\n    return 1\n");
            assertEquals("Expected '-' before requirement", e.getDetail());
            assertEquals("x", e.getToken().getLexeme());
        }
    }

    // ============ 类型注解 ============

    @Nested
    @DisplayName("类型注解")
    class TypeAnnotationTests {

        private TypeAnnotation inputType(String annotation) {
            FunctionDecl fn = parse("function f:\n  inputs:\n    p: " + annotation
                    + "\n  implementation:\n    return p\n").getFunctions().get(0);
            return fn.getInputs().get(0).getType();
        }

        @Test
        @DisplayName("泛型参数")
        void testGeneric() {
            TypeAnnotation t = inputType("Map<String, Integer>");
            assertEquals("Map", t.getName());
            assertTrue(t.isGeneric());
            assertEquals(2, t.getTypeArgs().size());
            assertEquals("Integer", t.getTypeArgs().get(1).getName());
        }

        @Test
        @DisplayName("嵌套泛型的 >> 被拆分")
        void testNestedGeneric() {
            TypeAnnotation t = inputType("List<List<Integer>>");
            assertEquals("List", t.getName());
            TypeAnnotation inner = t.getTypeArgs().get(0);
            assertEquals("List", inner.getName());
            assertEquals("Integer", inner.getTypeArgs().get(0).getName());
        }

        @Test
        @DisplayName("where 子句被跳过")
        void testWhereClause() {
            FunctionDecl fn = parse(
                    "function f:\n  inputs:\n    n: Integer where n > 0\n    m: Float\n" +
                    "  implementation:\n    return n\n").getFunctions().get(0);
            assertEquals(2, fn.getInputs().size());
            assertEquals("Integer", fn.getInputs().get(0).getType().getName());
            assertFalse(fn.getInputs().get(0).getType().isGeneric());
            assertEquals("Float", fn.getInputs().get(1).getType().getName());
        }

        @Test
        @DisplayName("缺少 '>' 报错")
        void testMissingCloseAngle() {
            ParseException e = parseError("function f:\n  inputs:\n    p: List<Integer\n  implementation:\n    return p\n");
            assertEquals("Expected '>' after type arguments", e.getDetail());
            assertEquals("GT", e.getExpected());
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("简单赋值")
        void testAssignment() {
            AssignStmt s = (AssignStmt) firstStatement("    x = 1\n");
            assertEquals(AssignStmt.AssignOp.ASSIGN, s.getOperator());
            assertEquals("x", ((Identifier) s.getTarget()).getName());
            assertEquals(1L, intValue(s.getValue()));
            assertFalse(s.isCompound());
            assertEquals(s.getTarget().getLocation(), s.getLocation());
        }

        @Test
        @DisplayName("复合赋值")
        void testCompoundAssignment() {
            Block b = body("    x += 1\n    x -= 2\n    x *= 3\n    x /= 4\n");
            assertEquals(AssignStmt.AssignOp.ADD_ASSIGN, ((AssignStmt) b.getStatements().get(0)).getOperator());
            assertEquals(AssignStmt.AssignOp.SUB_ASSIGN, ((AssignStmt) b.getStatements().get(1)).getOperator());
            assertEquals(AssignStmt.AssignOp.MUL_ASSIGN, ((AssignStmt) b.getStatements().get(2)).getOperator());
            assertEquals(AssignStmt.AssignOp.DIV_ASSIGN, ((AssignStmt) b.getStatements().get(3)).getOperator());
        }

        @Test
        @DisplayName("成员/索引作为赋值目标可以解析")
        void testNonIdentifierTarget() {
            AssignStmt s = (AssignStmt) firstStatement("    a.b = 1\n");
            assertTrue(s.getTarget() instanceof MemberExpr);
            assertFalse(s.hasIdentifierTarget());
        }

        @Test
        @DisplayName("表达式语句")
        void testExpressionStatement() {
            ExpressionStmt s = (ExpressionStmt) firstStatement("    foo(1, 2)\n");
            CallExpr call = (CallExpr) s.getExpression();
            assertEquals("foo", call.getCalleeName());
            assertEquals(2, call.getArgs().size());
        }

        @Test
        @DisplayName("无值 return")
        void testBareReturn() {
            Block b = body("    return\n    x = 1\n");
            assertFalse(((ReturnStmt) b.getStatements().get(0)).hasValue());
            assertEquals(2, b.getStatements().size());
            assertFalse(((ReturnStmt) firstStatement("    return")).hasValue());
        }

        @Test
        @DisplayName("if / else（缩进形式）")
        void testIfElse() {
            IfStmt s = (IfStmt) firstStatement(
                    "    if x > 0:\n      y = 1\n    else:\n      y = 2\n");
            assertTrue(s.getCondition() instanceof BinaryExpr);
            assertEquals(1, s.getThenBlock().getStatements().size());
            assertTrue(s.hasElse());
            assertEquals(1, s.getElseBlock().getStatements().size());
        }

        @Test
        @DisplayName("缩进块一直延续到终止 token")
        void testIndentationBlockAbsorbsFollowing() {
            Block b = body("    if c:\n      y = 1\n    z = 2\n");
            assertEquals(1, b.getStatements().size());
            IfStmt s = (IfStmt) b.getStatements().get(0);
            assertEquals(2, s.getThenBlock().getStatements().size());
            assertFalse(s.hasElse());
        }

        @Test
        @DisplayName("花括号块")
        void testBraceBlocks() {
            Block b = body("    if x > 0: { y = 1 } else: { y = 2 }\n    z = 3\n");
            assertEquals(2, b.getStatements().size());
            IfStmt s = (IfStmt) b.getStatements().get(0);
            assertEquals(1, s.getThenBlock().getStatements().size());
            assertEquals(1, s.getElseBlock().getStatements().size());
            assertTrue(b.getStatements().get(1) instanceof AssignStmt);
        }

        @Test
        @DisplayName("右花括号结束内层缩进块")
        void testCloseBraceEndsIndentationBlock() {
            Block b = body("    while x < 3: {\n      if x == 1: continue\n      x += 1\n    }\n    return x\n");
            assertEquals(2, b.getStatements().size());
            WhileStmt loop = (WhileStmt) b.getStatements().get(0);
            assertEquals(1, loop.getBody().getStatements().size());
            IfStmt inner = (IfStmt) loop.getBody().getStatements().get(0);
            assertEquals(2, inner.getThenBlock().getStatements().size());
            assertTrue(inner.getThenBlock().getStatements().get(0) instanceof ContinueStmt);
        }

        @Test
        @DisplayName("while 与 break")
        void testWhile() {
            WhileStmt s = (WhileStmt) firstStatement("    while true:\n      break\n");
            assertTrue(s.getBody().getStatements().get(0) instanceof BreakStmt);
        }

        @Test
        @DisplayName("ensure / otherwise")
        void testEnsureOtherwise() {
            EnsureStmt s = (EnsureStmt) firstStatement(
                    "    ensure n > 0:\n      r = n\n\n    otherwise:\n      r = 0\n");
            assertEquals(1, s.getThenBlock().getStatements().size());
            assertTrue(s.hasElse());
            assertEquals(1, s.getElseBlock().getStatements().size());
        }

        @Test
        @DisplayName("空函数体")
        void testEmptyBody() {
            assertTrue(body("").isEmpty());
            assertTrue(body("  {\n  }\n").isEmpty());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr e = (BinaryExpr) expr("1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, e.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) e.getRight()).getOperator());
        }

        @Test
        @DisplayName("二元运算左结合")
        void testLeftAssociative() {
            BinaryExpr e = (BinaryExpr) expr("1 - 2 - 3");
            assertEquals(3L, intValue(e.getRight()));
            BinaryExpr left = (BinaryExpr) e.getLeft();
            assertEquals(1L, intValue(left.getLeft()));
            assertEquals(2L, intValue(left.getRight()));
        }

        @Test
        @DisplayName("or 低于 and，相等低于比较")
        void testLogicalAndEquality() {
            BinaryExpr or = (BinaryExpr) expr("a or b and c");
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
            assertEquals(BinaryExpr.BinaryOp.AND, ((BinaryExpr) or.getRight()).getOperator());

            BinaryExpr eq = (BinaryExpr) expr("a == b < c");
            assertEquals(BinaryExpr.BinaryOp.EQ, eq.getOperator());
            assertEquals(BinaryExpr.BinaryOp.LT, ((BinaryExpr) eq.getRight()).getOperator());
        }

        @Test
        @DisplayName("一元运算")
        void testUnary() {
            BinaryExpr e = (BinaryExpr) expr("not a == b");
            assertEquals(UnaryExpr.UnaryOp.NOT, ((UnaryExpr) e.getLeft()).getOperator());

            UnaryExpr neg = (UnaryExpr) expr("- - x");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            assertTrue(neg.getOperand() instanceof UnaryExpr);

            assertEquals(UnaryExpr.UnaryOp.BIT_NOT, ((UnaryExpr) expr("~x")).getOperator());
        }

        @Test
        @DisplayName("幂运算右结合，且比一元负号绑定更紧")
        void testPower() {
            BinaryExpr pow = (BinaryExpr) expr("2 ** 3 ** 2");
            assertEquals(BinaryExpr.BinaryOp.POW, pow.getOperator());
            assertEquals(2L, intValue(pow.getLeft()));
            assertEquals(BinaryExpr.BinaryOp.POW, ((BinaryExpr) pow.getRight()).getOperator());

            UnaryExpr neg = (UnaryExpr) expr("-2 ** 2");
            assertEquals(BinaryExpr.BinaryOp.POW, ((BinaryExpr) neg.getOperand()).getOperator());

            BinaryExpr negExp = (BinaryExpr) expr("2 ** -1");
            assertTrue(negExp.getRight() instanceof UnaryExpr);
        }

        @Test
        @DisplayName("括号")
        void testParentheses() {
            BinaryExpr e = (BinaryExpr) expr("(1 + 2) * 3");
            assertEquals(BinaryExpr.BinaryOp.MUL, e.getOperator());
            assertEquals(BinaryExpr.BinaryOp.ADD, ((BinaryExpr) e.getLeft()).getOperator());
        }

        @Test
        @DisplayName("后缀链：调用、成员、索引")
        void testPostfix() {
            CallExpr chained = (CallExpr) expr("f(1)(2)");
            assertTrue(chained.getCallee() instanceof CallExpr);
            assertNull(chained.getCalleeName());

            IndexExpr idx = (IndexExpr) expr("a.b[0]");
            MemberExpr member = (MemberExpr) idx.getTarget();
            assertEquals("b", member.getMember());
            assertEquals(0L, intValue(idx.getIndex()));

            assertTrue(((CallExpr) expr("g()")).getArgs().isEmpty());
        }

        @Test
        @DisplayName("列表字面量")
        void testListLiteral() {
            assertEquals(3, ((ListLiteral) expr("[1, 2, 3]")).getElements().size());
            assertTrue(((ListLiteral) expr("[]")).getElements().isEmpty());
        }

        @Test
        @DisplayName("字面量值")
        void testLiterals() {
            assertEquals(3.5, ((Literal) expr("3.5")).getValue());
            assertEquals("hi", ((Literal) expr("\"hi\"")).getValue());
            assertEquals(Boolean.TRUE, ((Literal) expr("true")).getValue());
            assertTrue(((Literal) expr("null")).isNull());
        }

        @Test
        @DisplayName("二元节点位置取左操作数，一元节点位置取运算符")
        void testLocations() {
            BinaryExpr e = (BinaryExpr) expr("a + b");
            assertEquals(e.getLeft().getLocation(), e.getLocation());
            assertEquals(new SourceLocation("<test>", 3, 12), e.getLocation());

            UnaryExpr u = (UnaryExpr) expr("-x");
            assertEquals(12, u.getLocation().getColumn());
            assertEquals(13, u.getOperand().getLocation().getColumn());
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("顶层只能是函数")
        void testTopLevelStatement() {
            ParseException e = parseError("x = 1\n");
            assertEquals("Unexpected token: x", e.getDetail());
            assertEquals(new SourceLocation("<test>", 1, 1), e.getLocation());
        }

        @Test
        @DisplayName("缺少函数名")
        void testMissingFunctionName() {
            assertEquals("Expected function name", parseError("function :\n").getDetail());
        }

        @Test
        @DisplayName("函数名后缺少冒号")
        void testMissingColonAfterName() {
            assertEquals("Expected ':' after function name", parseError("function f\n").getDetail());
        }

        @Test
        @DisplayName("缺少 implementation")
        void testMissingImplementation() {
            ParseException e = parseError("function f:\n  inputs:\n    a\n");
            assertEquals("Expected 'implementation'", e.getDetail());
            assertEquals(TokenType.EOF, e.getToken().getType());
        }

        @Test
        @DisplayName("if 条件后缺少冒号")
        void testMissingColonAfterIf() {
            assertEquals("Expected ':' after if condition",
                    parseError("function f:\n  implementation:\n    if x > 0\n      y = 1\n").getDetail());
        }

        @Test
        @DisplayName("未闭合的括号")
        void testUnclosedDelimiters() {
            String prefix = "function f:\n  implementation:\n    return ";
            assertEquals("Expected ')' after arguments", parseError(prefix + "f(1, 2\n").getDetail());
            assertEquals("Expected ')' after expression", parseError(prefix + "(1 + 2\n").getDetail());
            assertEquals("Expected ']' after list elements", parseError(prefix + "[1, 2\n").getDetail());
            assertEquals("Expected ']' after index", parseError(prefix + "a[1\n").getDetail());
            assertEquals("Expected member name", parseError(prefix + "a.1\n").getDetail());
        }

        @Test
        @DisplayName("未闭合的花括号块")
        void testUnclosedBrace() {
            assertEquals("Expected '}' after block",
                    parseError("function f:\n  implementation: {\n    x = 1\n").getDetail());
        }

        @Test
        @DisplayName("输入意外结束")
        void testUnexpectedEnd() {
            ParseException e = parseError("function f:\n  implementation:\n    return 1 +");
            assertEquals("Unexpected end of input", e.getDetail());
        }

        @Test
        @DisplayName("意外 token")
        void testUnexpectedToken() {
            ParseException e = parseError("function f:\n  implementation:\n    return )\n");
            assertEquals("Unexpected token: )", e.getDetail());
            assertEquals("<test>:3:12: Unexpected token: )", e.getMessage());
        }

        @Test
        @DisplayName("token 序列必须以 EOF 结尾")
        void testTokensWithoutEof() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Parser(Collections.<Token>emptyList()));
        }
    }
}
