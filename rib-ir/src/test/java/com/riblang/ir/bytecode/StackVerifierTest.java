package com.riblang.ir.bytecode;

import com.riblang.ir.ir.RecordShape;
import com.riblang.ir.ir.VariantShape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import rib.runtime.RibInt;
import rib.runtime.RibValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 栈校验器测试：直接构造字节码，覆盖编译器不会生成的非法形状。
 */
class StackVerifierTest {

    private static Instruction op(Opcode opcode, int... operands) {
        return new Instruction(opcode, operands);
    }

    private static CompiledFunction function(String name, int params, int slots, Instruction... code) {
        List<String> names = new ArrayList<>();
        List<String> types = new ArrayList<>();
        for (int i = 0; i < params; i++) {
            names.add("p" + i);
            types.add("Int");
        }
        return new CompiledFunction(name, CompiledFunction.Kind.FUNCTION, names, types, "Int", slots, -1, code);
    }

    private static Program program(CompiledFunction... functions) {
        List<RibValue> constants = Collections.<RibValue>singletonList(RibInt.of(1));
        return new Program("<test>", constants,
                Collections.singletonList(new RecordShape("Pair", new String[]{"a", "b"})),
                Collections.singletonList(new VariantShape("Action", "Prepend", 1, 1)),
                Collections.singletonList(new ExternalCallEntry("Route.prefix", "FIELD",
                        Collections.singletonList("Route"), "Prefix")),
                Arrays.asList(functions));
    }

    private static int verify(Instruction... code) {
        return new StackVerifier().verify(program(function("f", 0, 3, code)))[0];
    }

    private static VerifyException reject(Instruction... code) {
        return assertThrows(VerifyException.class, () -> verify(code));
    }

    // ============ 合法代码 ============

    @Nested
    @DisplayName("合法代码")
    class AcceptedTests {

        @Test
        @DisplayName("最大深度取所有路径上的最大值")
        void testMaxDepth() {
            assertEquals(1, verify(op(Opcode.CONST, 0), op(Opcode.RETURN)));
            assertEquals(3, verify(
                    op(Opcode.CONST, 0), op(Opcode.CONST, 0), op(Opcode.CONST, 0),
                    op(Opcode.NEW_LIST, 3), op(Opcode.RETURN)));
        }

        @Test
        @DisplayName("构造记录与变体按布局检查操作数个数")
        void testShapes() {
            assertEquals(2, verify(op(Opcode.CONST, 0), op(Opcode.CONST, 0), op(Opcode.NEW_RECORD, 0, 2),
                    op(Opcode.RETURN)));
            assertEquals(1, verify(op(Opcode.CONST, 0), op(Opcode.NEW_VARIANT, 0, 1), op(Opcode.RETURN)));
            reject(op(Opcode.CONST, 0), op(Opcode.NEW_RECORD, 0, 1), op(Opcode.RETURN));
        }

        @Test
        @DisplayName("for 循环：LOOP 回跳到 ITER_NEXT")
        void testLoop() {
            assertEquals(1, verify(
                    op(Opcode.CONST, 0),
                    op(Opcode.STORE, 1),
                    op(Opcode.ITER_NEXT, 0, 1, 2, 4),
                    op(Opcode.LOOP, 2),
                    op(Opcode.CONST, 0),
                    op(Opcode.RETURN)));
        }

        @Test
        @DisplayName("两条路径在汇合点深度一致")
        void testBranchMerge() {
            assertEquals(1, verify(
                    op(Opcode.CONST, 0),
                    op(Opcode.JUMP_IF_FALSE, 4),
                    op(Opcode.CONST, 0),
                    op(Opcode.STORE, 0),
                    op(Opcode.LOAD, 0),
                    op(Opcode.RETURN)));
        }

        @Test
        @DisplayName("校验结果写回 Program")
        void testWithMaxStacks() {
            Program draft = program(function("f", 0, 1, op(Opcode.CONST, 0), op(Opcode.RETURN)));
            Program verified = draft.withMaxStacks(new StackVerifier().verify(draft));
            assertEquals(-1, draft.getFunction(0).getMaxStack());
            assertEquals(1, verified.getFunction(0).getMaxStack());
        }
    }

    // ============ 非法代码 ============

    @Nested
    @DisplayName("非法代码")
    class RejectedTests {

        @Test
        @DisplayName("栈下溢")
        void testUnderflow() {
            VerifyException e = reject(op(Opcode.CONST, 0), op(Opcode.ADD), op(Opcode.RETURN));
            assertEquals("f", e.getFunction());
            assertEquals(1, e.getPc());
        }

        @Test
        @DisplayName("退出指令要求深度恰好为 1")
        void testExitDepth() {
            reject(op(Opcode.CONST, 0), op(Opcode.CONST, 0), op(Opcode.RETURN));
        }

        @Test
        @DisplayName("控制转移要求深度为 0")
        void testTransferDepth() {
            reject(op(Opcode.CONST, 0), op(Opcode.JUMP, 2), op(Opcode.RETURN));
        }

        @Test
        @DisplayName("汇合点深度不一致")
        void testInconsistentMerge() {
            VerifyException e = reject(
                    op(Opcode.CONST, 0),
                    op(Opcode.JUMP_IF_FALSE, 3),
                    op(Opcode.CONST, 0),
                    op(Opcode.RETURN));
            assertTrue(e.getMessage().contains("inconsistent"), e.getMessage());
        }

        @Test
        @DisplayName("普通跳转不能向后")
        void testBackwardJump() {
            reject(op(Opcode.JUMP, 0));
        }

        @Test
        @DisplayName("LOOP 只能回到 ITER_NEXT")
        void testLoopTarget() {
            reject(op(Opcode.CONST, 0), op(Opcode.STORE, 0), op(Opcode.LOOP, 0));
        }

        @Test
        @DisplayName("执行越过代码末尾")
        void testFallOffEnd() {
            reject(op(Opcode.CONST, 0), op(Opcode.STORE, 0));
        }

        @Test
        @DisplayName("操作数越界")
        void testOperandRange() {
            reject(op(Opcode.CONST, 1), op(Opcode.RETURN));
            reject(op(Opcode.LOAD, 3), op(Opcode.RETURN));
            reject(op(Opcode.CONST, 0), op(Opcode.CALL_EXT, 1, 1), op(Opcode.RETURN));
            reject(op(Opcode.CONST, 0), op(Opcode.CALL_BUILTIN, 10_000, 1), op(Opcode.RETURN));
        }

        @Test
        @DisplayName("调用参数个数与被调函数不符")
        void testCallArity() {
            CompiledFunction callee = function("g", 2, 2, op(Opcode.LOAD, 0), op(Opcode.RETURN));
            CompiledFunction caller = function("f", 0, 0,
                    op(Opcode.CONST, 0), op(Opcode.CALL, 0, 1), op(Opcode.RETURN));
            assertThrows(VerifyException.class, () -> new StackVerifier().verify(program(callee, caller)));

            CompiledFunction good = function("f", 0, 0,
                    op(Opcode.CONST, 0), op(Opcode.CONST, 0), op(Opcode.CALL, 0, 2), op(Opcode.RETURN));
            assertArrayEquals(new int[]{1, 2}, new StackVerifier().verify(program(callee, good)));
        }

        @Test
        @DisplayName("外部调用参数个数包含接收者")
        void testExternalArity() {
            assertEquals(1, verify(op(Opcode.CONST, 0), op(Opcode.CALL_EXT, 0, 1), op(Opcode.RETURN)));
            reject(op(Opcode.CALL_EXT, 0, 0), op(Opcode.RETURN));
        }

        @Test
        @DisplayName("空函数")
        void testEmpty() {
            reject();
        }
    }
}
