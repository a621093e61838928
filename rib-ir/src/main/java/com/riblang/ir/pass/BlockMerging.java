package com.riblang.ir.pass;

import com.riblang.ir.ir.BasicBlock;
import com.riblang.ir.ir.IrFunction;
import com.riblang.ir.ir.IrModule;
import com.riblang.ir.ir.IrTerminator;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 合并单前驱/单后继基本块。
 * 如果块 A 以 goto B 结束，且 B 的唯一前驱是 A，则 A 吸收 B。
 */
public class BlockMerging implements IrPass {

    @Override
    public String getName() {
        return "BlockMerging";
    }

    @Override
    public IrModule run(IrModule module) {
        for (IrFunction function : module.getFunctions()) {
            mergeBlocks(function);
        }
        return module;
    }

    private void mergeBlocks(IrFunction function) {
        List<BasicBlock> blocks = function.getBlocks();
        if (blocks.size() <= 1) return;

        // 前驱计数和块映射（一次构建，增量维护）
        Map<Integer, Integer> predCount = new HashMap<>();
        Map<Integer, BasicBlock> blockMap = new HashMap<>();
        for (BasicBlock block : blocks) {
            blockMap.put(block.getId(), block);
            predCount.put(block.getId(), 0);
        }
        for (BasicBlock block : blocks) {
            if (!block.hasTerminator()) continue;
            for (int succ : block.getTerminator().getSuccessors()) {
                predCount.merge(succ, 1, Integer::sum);
            }
        }

        int entryId = blocks.get(0).getId();

        // 合并后回退索引以重新检查当前块（可能链式合并）
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            IrTerminator term = block.getTerminator();
            if (!(term instanceof IrTerminator.Goto)) continue;

            int targetId = ((IrTerminator.Goto) term).getTargetBlockId();
            BasicBlock target = blockMap.get(targetId);
            if (target == null) continue;

            Integer count = predCount.get(targetId);
            if (count == null || count != 1) continue;
            if (targetId == entryId || targetId == block.getId()) continue;

            block.getInstructions().addAll(target.getInstructions());
            block.setTerminator(target.getTerminator());

            blocks.remove(target);
            blockMap.remove(targetId);
            predCount.remove(targetId);

            i = blocks.indexOf(block) - 1;
        }
    }
}
