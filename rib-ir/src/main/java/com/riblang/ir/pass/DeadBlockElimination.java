package com.riblang.ir.pass;

import com.riblang.ir.ir.BasicBlock;
import com.riblang.ir.ir.IrFunction;
import com.riblang.ir.ir.IrModule;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * 删除不可达基本块。
 * 从 entry block 开始做可达性分析，移除所有不可达的块（终止表达式之后的代码等）。
 */
public class DeadBlockElimination implements IrPass {

    @Override
    public String getName() {
        return "DeadBlockElimination";
    }

    @Override
    public IrModule run(IrModule module) {
        for (IrFunction function : module.getFunctions()) {
            eliminateDeadBlocks(function);
        }
        return module;
    }

    private void eliminateDeadBlocks(IrFunction function) {
        if (function.getBlocks().size() <= 1) return;

        Map<Integer, BasicBlock> blockMap = new HashMap<>();
        for (BasicBlock block : function.getBlocks()) {
            blockMap.put(block.getId(), block);
        }

        // 从 entry block 开始 BFS 找可达块
        Set<Integer> reachable = new HashSet<>();
        Queue<Integer> worklist = new ArrayDeque<>();
        int entryId = function.getEntryBlock().getId();
        reachable.add(entryId);
        worklist.add(entryId);

        while (!worklist.isEmpty()) {
            BasicBlock block = blockMap.get(worklist.poll());
            if (block == null || !block.hasTerminator()) continue;
            for (int successor : block.getTerminator().getSuccessors()) {
                if (reachable.add(successor)) {
                    worklist.add(successor);
                }
            }
        }

        function.getBlocks().removeIf(block -> !reachable.contains(block.getId()));
    }
}
