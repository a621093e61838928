package com.riblang.compiler.diagnostic;

import com.riblang.compiler.ast.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次编译的诊断收集器
 *
 * <p>词法、语法、类型检查和代码生成共用同一个实例，按报告顺序保存，
 * 任何阶段都不会丢弃其他阶段的诊断。非线程安全，每个编译单元独占一个。</p>
 */
public final class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<Diagnostic>();
    private int errorCount;

    public void report(Diagnostic diagnostic) {
        entries.add(diagnostic);
        if (diagnostic.isError()) {
            errorCount++;
        }
    }

    public void error(DiagnosticKind kind, Span span, String message) {
        report(Diagnostic.error(kind, message, span));
    }

    public void warning(DiagnosticKind kind, Span span, String message) {
        report(Diagnostic.warning(kind, message, span));
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int size() {
        return entries.size();
    }

    /** 按报告顺序返回全部诊断（只读快照） */
    public List<Diagnostic> getAll() {
        return Collections.unmodifiableList(new ArrayList<Diagnostic>(entries));
    }
}
