package com.riblang.compiler.diagnostic;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * 诊断的 JSON 导出（供编辑器、CI 等外部展示层消费）
 */
public final class DiagnosticJson {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private DiagnosticJson() {
    }

    /**
     * 转换为 JSON 数组，保持诊断顺序
     *
     * @param diagnostics 诊断列表
     * @param source      对应的源码，用于计算行列号
     */
    public static JsonArray toJson(List<Diagnostic> diagnostics, String source) {
        LineIndex lines = new LineIndex(source);
        JsonArray result = new JsonArray();
        for (Diagnostic d : diagnostics) {
            JsonObject obj = new JsonObject();
            obj.addProperty("severity", d.getSeverity().name().toLowerCase());
            obj.addProperty("kind", d.getKind().getDisplayName());
            obj.addProperty("message", d.getMessage());
            JsonArray labels = new JsonArray();
            for (Label label : d.getLabels()) {
                JsonObject l = new JsonObject();
                l.addProperty("unit", label.getSpan().getUnitId());
                l.addProperty("start", label.getSpan().getStart());
                l.addProperty("end", label.getSpan().getEnd());
                l.add("range", range(lines, label));
                if (!label.getText().isEmpty()) {
                    l.addProperty("text", label.getText());
                }
                labels.add(l);
            }
            obj.add("labels", labels);
            result.add(obj);
        }
        return result;
    }

    public static String toJsonString(List<Diagnostic> diagnostics, String source) {
        return GSON.toJson(toJson(diagnostics, source));
    }

    private static JsonObject range(LineIndex lines, Label label) {
        JsonObject start = new JsonObject();
        start.addProperty("line", lines.line(label.getSpan().getStart()));
        start.addProperty("column", lines.column(label.getSpan().getStart()));
        JsonObject end = new JsonObject();
        end.addProperty("line", lines.line(label.getSpan().getEnd()));
        end.addProperty("column", lines.column(label.getSpan().getEnd()));
        JsonObject range = new JsonObject();
        range.add("start", start);
        range.add("end", end);
        return range;
    }
}
