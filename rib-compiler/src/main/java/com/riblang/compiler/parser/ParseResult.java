package com.riblang.compiler.parser;

import com.riblang.compiler.ast.SourceFile;

/**
 * 解析结果：尽力构造的 AST + 语法错误数量
 *
 * <p>错误详情已写入编译单元的诊断收集器。</p>
 */
public final class ParseResult {
    private final SourceFile sourceFile;
    private final int errorCount;

    public ParseResult(SourceFile sourceFile, int errorCount) {
        this.sourceFile = sourceFile;
        this.errorCount = errorCount;
    }

    public SourceFile getSourceFile() {
        return sourceFile;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }
}
