package com.riblang.ir.bytecode;

import com.riblang.compiler.CompilerOptions;
import com.riblang.compiler.host.ExternalTypeTable;
import com.riblang.ir.CompileResult;
import com.riblang.ir.RibCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import rib.runtime.RibInt;
import rib.runtime.RibValue;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IR → 字节码编译测试
 */
class BytecodeCompilerTest {

    private static final ExternalTypeTable TABLE = ExternalTypeTable.builder()
            .type("Route")
                .field("prefix", "Prefix")
                .field("as_path", "AsPath")
                .field("communities", "List<Community>")
                .method("has_community", "Bool", "Community")
                .done()
            .function("is_bogon", "Bool", "Prefix")
            .build();

    private static final String POLICY = "enum Decision { Keep, Drop, Tag(Int) }\n"
            + "type Summary { hops: Int, tagged: Bool }\n"
            + "function classify(route: Route) -> Decision {\n"
            + "  if is_bogon(route.prefix) { Decision.Drop }\n"
            + "  else if route.as_path.len() > 10 { Decision.Tag(route.as_path.len()) }\n"
            + "  else { Decision.Keep }\n"
            + "}\n"
            + "filtermap summarize(route: Route) -> Summary {\n"
            + "  let tagged = route.has_community(65000:100) || route.has_community(65000:200);\n"
            + "  for asn in route.as_path { if asn == AS23456 { reject } }\n"
            + "  match classify(route) {\n"
            + "    Drop => reject,\n"
            + "    Tag(n) => accept Summary { hops: n, tagged: tagged },\n"
            + "    Keep => accept Summary { hops: route.as_path.len(), tagged: tagged }\n"
            + "  }\n"
            + "}\n";

    private static Program compile(String source, CompilerOptions options) {
        CompileResult result = new RibCompiler(TABLE, options).compile(source, "<test>");
        assertTrue(result.isSuccess(), "Compile failed: " + result.getDiagnostics());
        return result.getProgram().get();
    }

    private static Program compile(String source) {
        return compile(source, CompilerOptions.defaults());
    }

    private static int count(CompiledFunction function, Opcode opcode) {
        int n = 0;
        for (int pc = 0; pc < function.getCodeLength(); pc++) {
            if (function.getInstruction(pc).getOpcode() == opcode) n++;
        }
        return n;
    }

    // ============ 常量与表 ============

    @Nested
    @DisplayName("常量池与外部调用表")
    class TableTests {

        @Test
        @DisplayName("相同的常量只占一个下标")
        void testConstantDedup() {
            Program program = compile("function f(a: Int) -> Int { a * 7 + 7 - 7 }");
            int sevens = 0;
            for (RibValue constant : program.getConstants()) {
                if (constant.equals(RibInt.of(7))) sevens++;
            }
            assertEquals(1, sevens);
        }

        @Test
        @DisplayName("外部调用按符号去重，参数类型包含接收者")
        void testExternalTable() {
            Program program = compile("function f(route: Route) -> Bool {\n"
                    + "  is_bogon(route.prefix) || route.prefix.len() > 24\n"
                    + "}");
            assertEquals(2, program.getExternals().size());
            // 参数先于调用求值，字段访问先入表
            ExternalCallEntry prefix = program.getExternals().get(0);
            assertEquals("Route.prefix", prefix.getSymbol());
            assertEquals("FIELD", prefix.getKind());
            assertEquals("Route", prefix.getParamTypes().get(0));
            assertEquals("Prefix", prefix.getReturnType());

            ExternalCallEntry bogon = program.getExternals().get(1);
            assertEquals("is_bogon", bogon.getSymbol());
            assertEquals(1, bogon.getArity());
            assertEquals("Bool", bogon.getReturnType());
        }

        @Test
        @DisplayName("函数签名以源码语法保存")
        void testSignatures() {
            CompiledFunction f = compile("function f(xs: List<Community>) -> Int { xs.len() }").findFunction("f");
            assertEquals("List<Community>", f.getParamTypes().get(0));
            assertEquals("Int", f.getReturnType());
            assertFalse(f.isEntryPoint());
        }
    }

    // ============ 布局与控制流 ============

    @Nested
    @DisplayName("布局与控制流")
    class LayoutTests {

        @Test
        @DisplayName("只有 LOOP 向后跳转，且目标为 ITER_NEXT")
        void testOnlyLoopJumpsBack() {
            for (CompiledFunction function : compile(POLICY).getFunctions()) {
                for (int pc = 0; pc < function.getCodeLength(); pc++) {
                    Instruction inst = function.getInstruction(pc);
                    if (inst.getOpcode() == Opcode.LOOP) {
                        assertTrue(inst.operand(0) < pc);
                        assertEquals(Opcode.ITER_NEXT, function.getInstruction(inst.operand(0)).getOpcode());
                    } else if (inst.getOpcode() == Opcode.JUMP || inst.getOpcode() == Opcode.JUMP_IF_FALSE) {
                        assertTrue(inst.operand(0) > pc, function.getName() + " @" + pc);
                    }
                }
            }
        }

        @Test
        @DisplayName("for 循环编译为 ITER_NEXT 与一个 LOOP")
        void testLoopShape() {
            CompiledFunction f = compile("function f(xs: List<Int>) -> Int { for x in xs { let _y = x; } 1 }")
                    .findFunction("f");
            assertEquals(1, count(f, Opcode.ITER_NEXT));
            assertEquals(1, count(f, Opcode.LOOP));
        }

        @Test
        @DisplayName("不可达代码不生成指令")
        void testDeadCodeDropped() {
            CompiledFunction f = compile("filter f(route: Route) { reject; accept }").findFunction("f");
            assertEquals(1, count(f, Opcode.REJECT));
            assertEquals(0, count(f, Opcode.ACCEPT));
            assertEquals(0, count(f, Opcode.TRAP));
        }

        @Test
        @DisplayName("reject 以 Unit 常量离开")
        void testRejectShape() {
            CompiledFunction f = compile("filter f(route: Route) { reject }").findFunction("f");
            assertEquals(Opcode.CONST, f.getInstruction(f.getCodeLength() - 2).getOpcode());
            assertEquals(Opcode.REJECT, f.getInstruction(f.getCodeLength() - 1).getOpcode());
            assertTrue(f.isEntryPoint());
            assertEquals(CompiledFunction.Kind.FILTER, f.getKind());
        }

        @Test
        @DisplayName("最大栈深度为调用参数个数")
        void testMaxStack() {
            Program program = compile("function g(a: Int, b: Int, c: Int) -> Int { a + b + c }\n"
                    + "function f() -> Int { g(1, 2, 3) }");
            assertEquals(3, program.findFunction("f").getMaxStack());
            assertEquals(2, program.findFunction("g").getMaxStack());
        }

        @Test
        @DisplayName("开启优化后仍通过校验，代码不变长")
        void testOptimized() {
            Program plain = compile(POLICY);
            Program optimized = compile(POLICY, CompilerOptions.builder().optimize(true).build());
            for (CompiledFunction function : optimized.getFunctions()) {
                assertTrue(function.getMaxStack() >= 1);
                assertTrue(function.getCodeLength() <= plain.findFunction(function.getName()).getCodeLength());
            }
        }
    }

    // ============ 序列化 ============

    @Nested
    @DisplayName("序列化")
    class EncodingTests {

        @Test
        @DisplayName("同一源码编译两次得到逐字节相同的结果")
        void testDeterministic() {
            byte[] first = compile(POLICY).encode();
            byte[] second = new RibCompiler(TABLE).compile(POLICY, "<test>").getProgram().get().encode();
            assertArrayEquals(first, second);
            assertEquals('R', first[0]);
            assertEquals('P', first[3]);
        }

        @Test
        @DisplayName("不同单元标识得到不同编码")
        void testUnitIdEncoded() {
            byte[] a = new RibCompiler(TABLE).compile("function f() -> Int { 1 }", "a").getProgram().get().encode();
            byte[] b = new RibCompiler(TABLE).compile("function f() -> Int { 1 }", "b").getProgram().get().encode();
            assertFalse(Arrays.equals(a, b));
        }

        @Test
        @DisplayName("反汇编列出常量、外部调用和每个函数")
        void testDisassemble() {
            String text = compile(POLICY).disassemble();
            assertTrue(text.startsWith("; unit <test>\n"), text);
            assertTrue(text.contains("externals:"), text);
            assertTrue(text.contains("function classify(route: Route) -> Decision"), text);
            assertTrue(text.contains("filter_map summarize(route: Route) -> Summary"), text);
            assertTrue(text.contains("ITER_NEXT"), text);
        }
    }
}
