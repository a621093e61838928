package com.riblang.ir;

import com.riblang.compiler.diagnostic.Diagnostic;
import com.riblang.ir.bytecode.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 一次编译的结果：没有错误级诊断时才带有 Program。
 */
public final class CompileResult {

    private final Program program;
    private final List<Diagnostic> diagnostics;

    CompileResult(Program program, List<Diagnostic> diagnostics) {
        this.program = program;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public Optional<Program> getProgram() {
        return Optional.ofNullable(program);
    }

    /** 按报告顺序排列的全部诊断 */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean isSuccess() {
        return program != null;
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                errors.add(diagnostic);
            }
        }
        return errors;
    }

    @Override
    public String toString() {
        return "CompileResult{success=" + isSuccess() + ", diagnostics=" + diagnostics.size() + "}";
    }
}
