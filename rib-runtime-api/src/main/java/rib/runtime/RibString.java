package rib.runtime;

/**
 * String 值
 */
public final class RibString extends RibValue {

    public static final RibString EMPTY = new RibString("");

    public static RibString of(String value) {
        return value.isEmpty() ? EMPTY : new RibString(value);
    }

    private final String value;

    private RibString(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RibString && ((RibString) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
