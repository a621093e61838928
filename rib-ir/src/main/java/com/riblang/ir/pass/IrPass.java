package com.riblang.ir.pass;

import com.riblang.ir.ir.IrModule;

/**
 * IR 优化 pass 接口。
 */
public interface IrPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对 IR 模块执行优化。
     */
    IrModule run(IrModule module);
}
