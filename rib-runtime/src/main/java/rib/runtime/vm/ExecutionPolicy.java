package rib.runtime.vm;

/**
 * 执行资源策略
 *
 * <p>限制单次调用可执行的指令数、操作数栈总深度与调用深度。
 * 超出任一限制时调用以 {@link FaultKind#RESOURCE_EXHAUSTED} 故障结束。</p>
 *
 * <p>使用示例：</p>
 * <pre>
 * // 预定义级别
 * VirtualMachine vm = new VirtualMachine(ExecutionPolicy.strict());
 *
 * // 自定义策略
 * ExecutionPolicy policy = ExecutionPolicy.custom()
 *     .maxInstructions(50_000)
 *     .maxCallDepth(8)
 *     .build();
 * </pre>
 */
public final class ExecutionPolicy {

    /** 策略级别 */
    public enum Level { STANDARD, STRICT, CUSTOM }

    private final Level level;
    private final long maxInstructions;
    private final int maxStackDepth;
    private final int maxCallDepth;

    private ExecutionPolicy(Builder builder) {
        this.level = builder.level;
        this.maxInstructions = builder.maxInstructions;
        this.maxStackDepth = builder.maxStackDepth;
        this.maxCallDepth = builder.maxCallDepth;
    }

    // ============ 预定义工厂方法 ============

    /** 标准模式：适合逐路由调用的常规策略 */
    public static ExecutionPolicy standard() {
        return new Builder(Level.STANDARD)
                .maxInstructions(1_000_000)
                .maxStackDepth(4096)
                .maxCallDepth(64)
                .build();
    }

    /** 严格模式：数据面热路径上的小预算 */
    public static ExecutionPolicy strict() {
        return new Builder(Level.STRICT)
                .maxInstructions(10_000)
                .maxStackDepth(256)
                .maxCallDepth(16)
                .build();
    }

    /** 自定义模式 Builder，初始值同标准模式 */
    public static Builder custom() {
        return new Builder(Level.CUSTOM);
    }

    public Level getLevel() {
        return level;
    }

    /** 单次调用最多执行的指令数 */
    public long getMaxInstructions() {
        return maxInstructions;
    }

    /** 所有活动帧的操作数栈容量之和上限 */
    public int getMaxStackDepth() {
        return maxStackDepth;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    @Override
    public String toString() {
        return "ExecutionPolicy{" + level + ", instructions=" + maxInstructions
                + ", stack=" + maxStackDepth + ", calls=" + maxCallDepth + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private final Level level;
        private long maxInstructions = 1_000_000;
        private int maxStackDepth = 4096;
        private int maxCallDepth = 64;

        Builder(Level level) {
            this.level = level;
        }

        public Builder maxInstructions(long maxInstructions) {
            if (maxInstructions <= 0) {
                throw new IllegalArgumentException("maxInstructions must be positive: " + maxInstructions);
            }
            this.maxInstructions = maxInstructions;
            return this;
        }

        public Builder maxStackDepth(int maxStackDepth) {
            if (maxStackDepth <= 0) {
                throw new IllegalArgumentException("maxStackDepth must be positive: " + maxStackDepth);
            }
            this.maxStackDepth = maxStackDepth;
            return this;
        }

        public Builder maxCallDepth(int maxCallDepth) {
            if (maxCallDepth <= 0) {
                throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
            }
            this.maxCallDepth = maxCallDepth;
            return this;
        }

        public ExecutionPolicy build() {
            return new ExecutionPolicy(this);
        }
    }
}
