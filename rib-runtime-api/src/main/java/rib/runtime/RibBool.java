package rib.runtime;

/**
 * Bool 值
 */
public final class RibBool extends RibValue {

    public static final RibBool TRUE = new RibBool(true);
    public static final RibBool FALSE = new RibBool(false);

    public static RibBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    private final boolean value;

    private RibBool(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public boolean asBool() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Bool";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RibBool && ((RibBool) o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
