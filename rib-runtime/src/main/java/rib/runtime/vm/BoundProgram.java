package rib.runtime.vm;

import com.riblang.ir.bytecode.Program;
import rib.runtime.HostFunction;

/**
 * 已绑定宿主函数的 Program。不可变，可被任意多个并发调用共享。
 *
 * @see VirtualMachine#attach
 */
public final class BoundProgram {

    private final Program program;
    private final HostFunction[] externals;

    BoundProgram(Program program, HostFunction[] externals) {
        this.program = program;
        this.externals = externals.clone();
    }

    public Program getProgram() {
        return program;
    }

    HostFunction getExternal(int index) {
        return externals[index];
    }

    @Override
    public String toString() {
        return "BoundProgram{" + program.getUnitId() + ", externals=" + externals.length + "}";
    }
}
