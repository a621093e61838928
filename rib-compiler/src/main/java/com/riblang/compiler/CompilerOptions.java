package com.riblang.compiler;

/**
 * 编译选项（不可变）
 *
 * <pre>
 * CompilerOptions options = CompilerOptions.builder()
 *         .optimize(false)
 *         .warningsAsErrors(true)
 *         .build();
 * </pre>
 */
public final class CompilerOptions {

    private static final CompilerOptions DEFAULTS = builder().build();

    private final boolean optimize;
    private final boolean warningsAsErrors;

    private CompilerOptions(Builder builder) {
        this.optimize = builder.optimize;
        this.warningsAsErrors = builder.warningsAsErrors;
    }

    /** 默认选项：启用 IR 优化，警告不升级 */
    public static CompilerOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 是否运行 IR 优化 pass（死块消除、块合并） */
    public boolean isOptimize() {
        return optimize;
    }

    /** 警告是否按错误处理（有警告时不产出 Program） */
    public boolean isWarningsAsErrors() {
        return warningsAsErrors;
    }

    public Builder toBuilder() {
        return new Builder().optimize(optimize).warningsAsErrors(warningsAsErrors);
    }

    @Override
    public String toString() {
        return "CompilerOptions{optimize=" + optimize + ", warningsAsErrors=" + warningsAsErrors + "}";
    }

    public static final class Builder {
        private boolean optimize = true;
        private boolean warningsAsErrors;

        private Builder() {
        }

        public Builder optimize(boolean optimize) {
            this.optimize = optimize;
            return this;
        }

        public Builder warningsAsErrors(boolean warningsAsErrors) {
            this.warningsAsErrors = warningsAsErrors;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
