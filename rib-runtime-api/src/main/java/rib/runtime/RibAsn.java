package rib.runtime;

/**
 * Asn 值（32 位自治系统号）
 */
public final class RibAsn extends RibValue {

    public static final long MAX_VALUE = 0xFFFFFFFFL;

    public static final RibAsn ZERO = new RibAsn(0);

    public static RibAsn of(long value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("ASN out of range: " + value);
        }
        return value == 0 ? ZERO : new RibAsn(value);
    }

    /**
     * 解析 {@code AS65000} 形式的文本（前缀大小写不敏感）
     */
    public static RibAsn parse(String text) {
        if (text.length() < 3 || !text.regionMatches(true, 0, "AS", 0, 2)) {
            throw new IllegalArgumentException("Invalid ASN: " + text);
        }
        String digits = text.substring(2);
        if (digits.length() > 10) {
            throw new IllegalArgumentException("ASN out of range: " + text);
        }
        long value = 0;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Invalid ASN: " + text);
            }
            value = value * 10 + (c - '0');
        }
        return of(value);
    }

    private final long value;

    private RibAsn(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Asn";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RibAsn && ((RibAsn) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "AS" + value;
    }
}
