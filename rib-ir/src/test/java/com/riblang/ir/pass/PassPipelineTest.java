package com.riblang.ir.pass;

import com.riblang.compiler.analysis.types.RibTypes;
import com.riblang.ir.ir.BasicBlock;
import com.riblang.ir.ir.IrBuilder;
import com.riblang.ir.ir.IrFunction;
import com.riblang.ir.ir.IrModule;
import com.riblang.ir.ir.IrTerminator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import rib.runtime.RibBool;
import rib.runtime.RibInt;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IR 优化 pass 测试
 */
class PassPipelineTest {

    private static IrFunction newFunction() {
        return new IrFunction("f", IrFunction.Kind.FUNCTION, Collections.<String>emptyList(),
                Collections.emptyList(), RibTypes.INT);
    }

    private static IrModule moduleOf(IrFunction function) {
        IrModule module = new IrModule("<test>");
        module.addFunction(function);
        return module;
    }

    @Nested
    @DisplayName("DeadBlockElimination")
    class DeadBlockTests {

        @Test
        @DisplayName("删除终止指令之后没有前驱的块")
        void testRemovesUnreachable() {
            IrFunction f = newFunction();
            IrBuilder b = new IrBuilder(f);
            int value = b.emitConst(RibInt.of(1), null);
            b.terminate(new IrTerminator.Return(null, value));
            BasicBlock dead = b.newBlock();
            b.switchToBlock(dead);
            b.terminate(new IrTerminator.Return(null, b.emitConst(RibInt.of(2), null)));

            new DeadBlockElimination().run(moduleOf(f));

            assertEquals(1, f.getBlocks().size());
            assertNull(f.findBlock(dead.getId()));
        }

        @Test
        @DisplayName("保留经分支可达的块")
        void testKeepsReachable() {
            IrFunction f = newFunction();
            IrBuilder b = new IrBuilder(f);
            int cond = b.emitConst(RibBool.TRUE, null);
            BasicBlock then = b.newBlock();
            BasicBlock otherwise = b.newBlock();
            b.emitBranch(cond, then.getId(), otherwise.getId(), null);
            b.switchToBlock(then);
            b.terminate(new IrTerminator.Return(null, cond));
            b.switchToBlock(otherwise);
            b.terminate(new IrTerminator.Return(null, cond));

            new DeadBlockElimination().run(moduleOf(f));

            assertEquals(3, f.getBlocks().size());
        }
    }

    @Nested
    @DisplayName("BlockMerging")
    class BlockMergingTests {

        @Test
        @DisplayName("goto 链合并为一个块")
        void testMergesChain() {
            IrFunction f = newFunction();
            IrBuilder b = new IrBuilder(f);
            BasicBlock second = b.newBlock();
            BasicBlock third = b.newBlock();
            b.emitConst(RibInt.of(1), null);
            b.emitGoto(second.getId(), null);
            b.switchToBlock(second);
            b.emitConst(RibInt.of(2), null);
            b.emitGoto(third.getId(), null);
            b.switchToBlock(third);
            int last = b.emitConst(RibInt.of(3), null);
            b.terminate(new IrTerminator.Return(null, last));

            new BlockMerging().run(moduleOf(f));

            assertEquals(1, f.getBlocks().size());
            BasicBlock entry = f.getEntryBlock();
            assertEquals(3, entry.getInstructions().size());
            assertTrue(entry.getTerminator() instanceof IrTerminator.Return);
        }

        @Test
        @DisplayName("多个前驱的块不被合并")
        void testKeepsJoinPoints() {
            IrFunction f = newFunction();
            IrBuilder b = new IrBuilder(f);
            int cond = b.emitConst(RibBool.TRUE, null);
            BasicBlock then = b.newBlock();
            BasicBlock otherwise = b.newBlock();
            BasicBlock merge = b.newBlock();
            b.emitBranch(cond, then.getId(), otherwise.getId(), null);
            b.switchToBlock(then);
            b.emitGoto(merge.getId(), null);
            b.switchToBlock(otherwise);
            b.emitGoto(merge.getId(), null);
            b.switchToBlock(merge);
            b.terminate(new IrTerminator.Return(null, cond));

            new BlockMerging().run(moduleOf(f));

            assertEquals(4, f.getBlocks().size());
        }
    }

    @Test
    @DisplayName("默认管线的 pass 顺序")
    void testDefaultPipeline() {
        PassPipeline pipeline = PassPipeline.createDefault();
        assertEquals(3, pipeline.getPasses().size());
        assertEquals("DeadBlockElimination", pipeline.getPasses().get(0).getName());
        assertEquals("BlockMerging", pipeline.getPasses().get(1).getName());
    }
}
