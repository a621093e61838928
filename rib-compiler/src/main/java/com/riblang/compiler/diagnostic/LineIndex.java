package com.riblang.compiler.diagnostic;

import java.util.Arrays;

/**
 * 字符偏移到行列号（均从 1 开始）的换算表
 */
public final class LineIndex {

    private final int[] lineStarts;

    public LineIndex(String source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public int line(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return (index >= 0 ? index : -index - 2) + 1;
    }

    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }

    public int getLineCount() {
        return lineStarts.length;
    }
}
