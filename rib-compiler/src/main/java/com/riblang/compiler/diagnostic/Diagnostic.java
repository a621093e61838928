package com.riblang.compiler.diagnostic;

import com.riblang.compiler.ast.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构化诊断信息
 *
 * <p>第一个标注为主标注，指向问题所在位置；其余标注提供相关上下文
 * （例如重复定义时指向首次定义）。</p>
 */
public final class Diagnostic {

    private final Severity severity;
    private final DiagnosticKind kind;
    private final String message;
    private final List<Label> labels;

    public Diagnostic(Severity severity, DiagnosticKind kind, String message, List<Label> labels) {
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("Diagnostic needs at least one label");
        }
        this.severity = severity;
        this.kind = kind;
        this.message = message;
        this.labels = Collections.unmodifiableList(new ArrayList<Label>(labels));
    }

    public static Diagnostic error(DiagnosticKind kind, String message, Span span) {
        return new Diagnostic(Severity.ERROR, kind, message, Collections.singletonList(new Label(span, "")));
    }

    public static Diagnostic warning(DiagnosticKind kind, String message, Span span) {
        return new Diagnostic(Severity.WARNING, kind, message, Collections.singletonList(new Label(span, "")));
    }

    /** 追加一个辅助标注，返回新的诊断 */
    public Diagnostic withLabel(Span span, String text) {
        List<Label> extended = new ArrayList<Label>(labels);
        extended.add(new Label(span, text));
        return new Diagnostic(severity, kind, message, extended);
    }

    /** 以指定级别复制（warnings-as-errors 时使用） */
    public Diagnostic withSeverity(Severity newSeverity) {
        return new Diagnostic(newSeverity, kind, message, labels);
    }

    public Severity getSeverity() {
        return severity;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public List<Label> getLabels() {
        return labels;
    }

    /** 主标注所在区间 */
    public Span getSpan() {
        return labels.get(0).getSpan();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity.name().toLowerCase() + "[" + kind.getDisplayName() + "] " + getSpan() + ": " + message;
    }
}
