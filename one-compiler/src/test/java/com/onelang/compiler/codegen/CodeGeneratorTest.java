package com.onelang.compiler.codegen;

import com.onelang.compiler.ast.decl.Program;
import com.onelang.compiler.bytecode.*;
import com.onelang.compiler.lexer.Lexer;
import com.onelang.compiler.lexer.SourceLocation;
import com.onelang.compiler.parser.Parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 字节码生成测试
 */
class CodeGeneratorTest {

    private static final String ADD_SOURCE =
            "function add:\n" +
            "  inputs:\n" +
            "    a: Integer\n" +
            "    b: Integer\n" +
            "  outputs:\n" +
            "    result: Integer\n" +
            "  implementation:\n" +
            "    return a + b\n";

    // ============ 测试辅助方法 ============

    private Program parse(String source) {
        return new Parser(new Lexer(source, "<test>").scanTokens()).parse();
    }

    private BytecodeModule generate(String source) {
        return new CodeGenerator().generate(parse(source));
    }

    /** 生成 main 函数（语句放在 implementation 中） */
    private CompiledFunction main(String statements) {
        return generate("function main:\n  inputs:\n    c\n  implementation:\n" + statements).getFunction("main");
    }

    private CodegenException codegenError(String statements) {
        return assertThrows(CodegenException.class,
                () -> generate("function main:\n  implementation:\n" + statements));
    }

    private static Instruction ins(OpCode op) {
        return new Instruction(op);
    }

    private static Instruction ins(OpCode op, Object operand) {
        return new Instruction(op, operand);
    }

    private static List<Instruction> seq(Instruction... instructions) {
        return Arrays.asList(instructions);
    }

    /** 所有跳转都已回填且目标在函数范围内 */
    private void assertJumpsResolved(CompiledFunction fn) {
        for (Instruction inst : fn.getInstructions()) {
            assertTrue(inst.isResolved(), "Unresolved: " + inst);
            if (inst.getOpcode().isJump()) {
                int target = inst.getJumpTarget();
                assertTrue(target >= 0 && target < fn.size(), "Jump out of range: " + inst);
            }
        }
    }

    // ============ 函数与返回 ============

    @Nested
    @DisplayName("函数与返回")
    class FunctionTests {

        @Test
        @DisplayName("add 示例生成恰好四条指令")
        void testAddExample() {
            BytecodeModule module = generate(ADD_SOURCE);
            CompiledFunction add = module.getFunction("add");
            assertEquals(seq(
                    ins(OpCode.LOAD_VAR, "a"),
                    ins(OpCode.LOAD_VAR, "b"),
                    ins(OpCode.ADD),
                    ins(OpCode.RETURN)), add.getInstructions());
            assertEquals(Arrays.asList("a", "b"), add.getParamNames());
            assertEquals(2, add.getParamCount());
        }

        @Test
        @DisplayName("指令携带源码位置")
        void testLocations() {
            CompiledFunction add = generate(ADD_SOURCE).getFunction("add");
            assertEquals(new SourceLocation("<test>", 8, 12), add.getInstruction(0).getLocation());
            assertEquals(new SourceLocation("<test>", 8, 5), add.getInstruction(3).getLocation());
        }

        @Test
        @DisplayName("空函数体生成隐式返回")
        void testEmptyBody() {
            assertEquals(seq(ins(OpCode.LOAD_CONST, null), ins(OpCode.RETURN)), main("").getInstructions());
        }

        @Test
        @DisplayName("无值 return 压入 null，且不追加隐式返回")
        void testBareReturn() {
            assertEquals(seq(ins(OpCode.LOAD_CONST, null), ins(OpCode.RETURN)), main("    return\n").getInstructions());
        }

        @Test
        @DisplayName("默认入口为 main，函数按定义顺序保存")
        void testModuleOrder() {
            BytecodeModule module = generate(
                    "function b:\n  implementation:\n    return 1\n" +
                    "function main:\n  implementation:\n    return b()\n");
            assertEquals("main", module.getEntryPoint());
            assertEquals(Arrays.asList("b", "main"), new ArrayList<String>(module.getFunctions().keySet()));
            assertSame(module.getFunction("main"), module.getEntryFunction());
        }

        @Test
        @DisplayName("同名函数后定义者覆盖")
        void testDuplicateLastWins() {
            BytecodeModule module = generate(
                    "function f:\n  implementation:\n    return 1\n" +
                    "function f:\n  implementation:\n    return 2\n");
            assertEquals(1, module.getFunctions().size());
            assertEquals(ins(OpCode.LOAD_CONST, 2L), module.getFunction("f").getInstruction(0));
        }

        @Test
        @DisplayName("要求入口函数时缺失报错")
        void testMissingEntryPoint() {
            CodeGenerator generator = new CodeGenerator("start", true);
            CodegenException e = assertThrows(CodegenException.class,
                    () -> generator.generate(parse("function main:\n  implementation:\n    return 1\n")));
            assertEquals("Missing entry point function: start", e.getDetail());

            BytecodeModule module = new CodeGenerator("start", false)
                    .generate(parse("function main:\n  implementation:\n    return 1\n"));
            assertEquals("start", module.getEntryPoint());
            assertNull(module.getEntryFunction());
        }

        @Test
        @DisplayName("常量按首次出现去重")
        void testConstants() {
            CompiledFunction fn = main("    x = 1\n    y = 1\n    z = \"s\"\n");
            assertEquals(Arrays.<Object>asList(1L, "s", null), fn.getConstants());
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("复合赋值展开")
        void testCompoundAssignment() {
            assertEquals(seq(
                    ins(OpCode.LOAD_CONST, 10L),
                    ins(OpCode.STORE_VAR, "x"),
                    ins(OpCode.LOAD_CONST, 3L),
                    ins(OpCode.LOAD_VAR, "x"),
                    ins(OpCode.SUB),
                    ins(OpCode.STORE_VAR, "x"),
                    ins(OpCode.LOAD_CONST, null),
                    ins(OpCode.RETURN)), main("    x = 10\n    x -= 3\n").getInstructions());

            List<Instruction> code = main("    x *= 2\n    x /= 2\n    x += 2\n").getInstructions();
            assertEquals(OpCode.MUL, code.get(2).getOpcode());
            assertEquals(OpCode.DIV, code.get(6).getOpcode());
            assertEquals(OpCode.ADD, code.get(10).getOpcode());
        }

        @Test
        @DisplayName("表达式语句后跟 POP")
        void testExpressionStatement() {
            assertEquals(seq(
                    ins(OpCode.LOAD_CONST, "a"),
                    ins(OpCode.LOAD_CONST, "b"),
                    ins(OpCode.PRINT),
                    ins(OpCode.POP),
                    ins(OpCode.LOAD_CONST, "c"),
                    ins(OpCode.PRINTLN),
                    ins(OpCode.POP),
                    ins(OpCode.LOAD_CONST, null),
                    ins(OpCode.RETURN)), main("    print(\"a\", \"b\")\n    println(\"c\")\n").getInstructions());
        }

        @Test
        @DisplayName("print / println 不带操作数")
        void testPrintHasNoOperand() {
            CompiledFunction fn = main("    print(\"a\", \"b\")\n    println(\"c\")\n    x = len(\"d\")\n");
            int intrinsics = 0;
            for (Instruction inst : fn.getInstructions()) {
                if (inst.getOpcode() == OpCode.PRINT || inst.getOpcode() == OpCode.PRINTLN) {
                    assertNull(inst.getOperand(), "operand of " + inst);
                    intrinsics++;
                }
            }
            assertEquals(2, intrinsics);
            assertTrue(fn.getInstructions().contains(ins(OpCode.CALL, new CallTarget("len", 1))));
        }

        @Test
        @DisplayName("if / else")
        void testIfElse() {
            CompiledFunction fn = main("    if c: { return 1 } else: { return 2 }\n");
            assertEquals(seq(
                    ins(OpCode.LOAD_VAR, "c"),
                    ins(OpCode.JUMP_IF_FALSE, 5),
                    ins(OpCode.LOAD_CONST, 1L),
                    ins(OpCode.RETURN),
                    ins(OpCode.JUMP, 7),
                    ins(OpCode.LOAD_CONST, 2L),
                    ins(OpCode.RETURN),
                    ins(OpCode.LOAD_CONST, null),
                    ins(OpCode.RETURN)), fn.getInstructions());
            assertJumpsResolved(fn);
        }

        @Test
        @DisplayName("没有 else 的 if")
        void testIfWithoutElse() {
            assertEquals(seq(
                    ins(OpCode.LOAD_VAR, "c"),
                    ins(OpCode.JUMP_IF_FALSE, 5),
                    ins(OpCode.LOAD_CONST, 1L),
                    ins(OpCode.STORE_VAR, "x"),
                    ins(OpCode.JUMP, 5),
                    ins(OpCode.LOAD_CONST, null),
                    ins(OpCode.RETURN)), main("    if c: { x = 1 }\n").getInstructions());
        }

        @Test
        @DisplayName("ensure 与 if 生成相同指令")
        void testEnsureMatchesIf() {
            assertEquals(
                    main("    if c: { x = 1 } else: { x = 2 }\n").getInstructions(),
                    main("    ensure c: { x = 1 } otherwise: { x = 2 }\n").getInstructions());
        }

        @Test
        @DisplayName("while 循环回跳到条件开始处")
        void testWhileLoop() {
            CompiledFunction fn = main("    x = 0\n    while x < 3:\n      x += 1\n");
            assertEquals(seq(
                    ins(OpCode.LOAD_CONST, 0L),
                    ins(OpCode.STORE_VAR, "x"),
                    ins(OpCode.LOAD_VAR, "x"),
                    ins(OpCode.LOAD_CONST, 3L),
                    ins(OpCode.LT),
                    ins(OpCode.JUMP_IF_FALSE, 11),
                    ins(OpCode.LOAD_CONST, 1L),
                    ins(OpCode.LOAD_VAR, "x"),
                    ins(OpCode.ADD),
                    ins(OpCode.STORE_VAR, "x"),
                    ins(OpCode.JUMP, 2),
                    ins(OpCode.LOAD_CONST, null),
                    ins(OpCode.RETURN)), fn.getInstructions());

            int backJump = 10;
            assertEquals(ins(OpCode.STORE_VAR, "x"), fn.getInstruction(backJump - 1));
            int start = fn.getInstruction(backJump).getJumpTarget();
            assertEquals(ins(OpCode.LOAD_VAR, "x"), fn.getInstruction(start));
        }

        @Test
        @DisplayName("break 跳到循环结束，continue 跳回条件")
        void testBreakContinue() {
            CompiledFunction fn = main(
                    "    x = 0\n" +
                    "    while true: {\n" +
                    "      if x > 5: { break }\n" +
                    "      x += 1\n" +
                    "      continue\n" +
                    "    }\n");
            assertJumpsResolved(fn);

            int loopStart = 2;
            int loopEnd = 16;
            assertEquals(ins(OpCode.JUMP_IF_FALSE, loopEnd), fn.getInstruction(3));
            assertEquals(ins(OpCode.JUMP, loopEnd), fn.getInstruction(8));
            assertEquals(ins(OpCode.JUMP, loopStart), fn.getInstruction(14));
            assertEquals(ins(OpCode.JUMP, loopStart), fn.getInstruction(15));
            assertEquals(ins(OpCode.RETURN), fn.getInstruction(fn.size() - 1));
            assertEquals(18, fn.size());
        }

        @Test
        @DisplayName("嵌套循环中 break 只跳出内层")
        void testNestedLoops() {
            CompiledFunction fn = main(
                    "    while a: {\n" +
                    "      while b: { break }\n" +
                    "      x = 1\n" +
                    "    }\n");
            assertJumpsResolved(fn);
            // 0 LOAD_VAR a, 1 JIF, 2 LOAD_VAR b, 3 JIF, 4 JUMP(break), 5 JUMP 2, 6 LOAD_CONST 1 ...
            assertEquals(ins(OpCode.JUMP, 6), fn.getInstruction(4));
            assertEquals(ins(OpCode.JUMP_IF_FALSE, 6), fn.getInstruction(3));
        }

        @Test
        @DisplayName("循环外的 break / continue 报错")
        void testBreakOutsideLoop() {
            CodegenException e = codegenError("    break\n");
            assertEquals("break outside of loop", e.getDetail());
            assertEquals(new SourceLocation("<test>", 3, 5), e.getLocation());

            assertEquals("continue outside of loop", codegenError("    if true: { continue }\n").getDetail());
        }

        @Test
        @DisplayName("非变量的赋值目标报错")
        void testNonIdentifierAssignment() {
            assertNotNull(codegenError("    a.b = 1\n"));
            CodegenException e = codegenError("    xs[0] += 1\n");
            assertEquals(new SourceLocation("<test>", 3, 5), e.getLocation());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        private List<Instruction> returning(String expression) {
            List<Instruction> code = main("    return " + expression + "\n").getInstructions();
            return code.subList(0, code.size() - 1);
        }

        @Test
        @DisplayName("二元运算映射")
        void testBinaryOperators() {
            String[] sources = {"%", "**", "==", "!=", "<", ">", "<=", ">=", "and", "or", "-", "*", "/"};
            OpCode[] expected = {OpCode.MOD, OpCode.POW, OpCode.EQ, OpCode.NE, OpCode.LT, OpCode.GT,
                    OpCode.LE, OpCode.GE, OpCode.AND, OpCode.OR, OpCode.SUB, OpCode.MUL, OpCode.DIV};
            for (int i = 0; i < sources.length; i++) {
                List<Instruction> code = returning("a " + sources[i] + " b");
                assertEquals(seq(ins(OpCode.LOAD_VAR, "a"), ins(OpCode.LOAD_VAR, "b"), ins(expected[i])), code,
                        "operator " + sources[i]);
            }
        }

        @Test
        @DisplayName("一元运算")
        void testUnary() {
            assertEquals(seq(ins(OpCode.LOAD_VAR, "x"), ins(OpCode.NEG)), returning("-x"));
            assertEquals(seq(ins(OpCode.LOAD_VAR, "x"), ins(OpCode.NOT)), returning("not x"));
        }

        @Test
        @DisplayName("~ 没有对应指令")
        void testBitNotRejected() {
            assertEquals("Unknown unary operator: ~", codegenError("    return ~x\n").getDetail());
        }

        @Test
        @DisplayName("调用：实参自左向右，随后 CALL")
        void testCall() {
            assertEquals(seq(
                    ins(OpCode.LOAD_CONST, 1L),
                    ins(OpCode.LOAD_VAR, "y"),
                    ins(OpCode.CALL, new CallTarget("add", 2))), returning("add(1, y)"));
        }

        @Test
        @DisplayName("非简单名称的调用目标报错")
        void testComplexCallee() {
            assertEquals("Only simple function calls are supported", codegenError("    f(1)(2)\n").getDetail());
        }

        @Test
        @DisplayName("列表与索引")
        void testListAndIndex() {
            assertEquals(seq(
                    ins(OpCode.LOAD_CONST, 1L),
                    ins(OpCode.LOAD_CONST, 2L),
                    ins(OpCode.BUILD_LIST, 2),
                    ins(OpCode.LOAD_CONST, 0L),
                    ins(OpCode.INDEX)), returning("[1, 2][0]"));
            assertEquals(seq(ins(OpCode.BUILD_LIST, 0)), returning("[]"));
        }

        @Test
        @DisplayName("成员访问压入 null")
        void testMemberAccess() {
            assertEquals(seq(ins(OpCode.LOAD_CONST, null)), returning("a.b"));
        }

        @Test
        @DisplayName("字面量常量")
        void testLiterals() {
            assertEquals(seq(ins(OpCode.LOAD_CONST, 2.5)), returning("2.5"));
            assertEquals(seq(ins(OpCode.LOAD_CONST, Boolean.TRUE)), returning("true"));
            assertEquals(seq(ins(OpCode.LOAD_CONST, "s")), returning("\"s\""));
        }
    }

    // ============ 标签 ============

    @Nested
    @DisplayName("标签")
    class LabelTests {

        @Test
        @DisplayName("标签名称与绑定")
        void testLabel() {
            Label label = new Label(3);
            assertEquals("L3", label.getName());
            assertFalse(label.isBound());
            label.addPatchSite(7);
            label.bind(10);
            assertEquals(10, label.getPosition());
            assertEquals(Arrays.asList(7), label.getPatchSites());
            assertThrows(IllegalStateException.class, () -> label.bind(11));
        }
    }
}
