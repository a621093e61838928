package com.riblang.ir.pass;

import com.riblang.ir.ir.IrModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR 优化 pass 管线，按添加顺序依次执行。
 */
public class PassPipeline {

    private final List<IrPass> passes = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线：删除不可达块，合并直线块，再清理一次。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new DeadBlockElimination());
        pipeline.addPass(new BlockMerging());
        pipeline.addPass(new DeadBlockElimination());  // 清理合并后的不可达块
        return pipeline;
    }

    public void addPass(IrPass pass) {
        passes.add(pass);
    }

    public List<IrPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public IrModule run(IrModule module) {
        for (IrPass pass : passes) {
            module = pass.run(module);
        }
        return module;
    }
}
