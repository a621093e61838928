package com.riblang.compiler;

import com.riblang.compiler.diagnostic.Diagnostics;
import com.riblang.compiler.host.ExternalTypeTable;

/**
 * 单个编译单元的上下文
 *
 * <p>每次编译独占一个实例（诊断收集器、作用域都从这里派生），
 * 外部类型表与选项为不可变共享对象。</p>
 */
public final class CompilationContext {

    private final String unitId;
    private final String source;
    private final ExternalTypeTable typeTable;
    private final CompilerOptions options;
    private final Diagnostics diagnostics = new Diagnostics();

    public CompilationContext(String unitId, String source, ExternalTypeTable typeTable, CompilerOptions options) {
        this.unitId = unitId;
        this.source = source;
        this.typeTable = typeTable;
        this.options = options;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getSource() {
        return source;
    }

    public ExternalTypeTable getTypeTable() {
        return typeTable;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
