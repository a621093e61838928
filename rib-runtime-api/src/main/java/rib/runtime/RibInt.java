package rib.runtime;

/**
 * Int 值（64位有符号整数）
 */
public final class RibInt extends RibValue {

    // 小整数缓存（覆盖前缀长度、计数器等常见范围）
    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final RibInt[] CACHE = new RibInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RibInt(CACHE_LOW + i);
        }
    }

    public static final RibInt ZERO = of(0);

    /** 获取 RibInt 实例，优先从缓存取 */
    public static RibInt of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new RibInt(value);
    }

    private final long value;

    private RibInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public long asLong() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Int";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RibInt && ((RibInt) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
