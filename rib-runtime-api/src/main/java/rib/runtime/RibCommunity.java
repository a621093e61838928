package rib.runtime;

/**
 * Community 值（RFC 1997 标准团体属性，高 16 位为 ASN，低 16 位为值）
 */
public final class RibCommunity extends RibValue {

    public static RibCommunity of(int asn, int value) {
        if (asn < 0 || asn > 0xFFFF || value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("Community part out of range: " + asn + ":" + value);
        }
        return new RibCommunity(asn, value);
    }

    /**
     * 解析 {@code 65000:100} 形式的文本
     */
    public static RibCommunity parse(String text) {
        int colon = text.indexOf(':');
        if (colon <= 0 || colon == text.length() - 1 || text.indexOf(':', colon + 1) >= 0) {
            throw new IllegalArgumentException("Invalid community: " + text);
        }
        return of(parsePart(text.substring(0, colon), text), parsePart(text.substring(colon + 1), text));
    }

    private static int parsePart(String part, String text) {
        if (part.length() > 5) {
            throw new IllegalArgumentException("Community part out of range: " + text);
        }
        int value = 0;
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Invalid community: " + text);
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }

    private final int asn;
    private final int value;

    private RibCommunity(int asn, int value) {
        this.asn = asn;
        this.value = value;
    }

    public int getAsn() {
        return asn;
    }

    public int getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Community";
    }

    @Override
    public Object toJavaValue() {
        return ((long) asn << 16) | value;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RibCommunity)) return false;
        RibCommunity other = (RibCommunity) o;
        return other.asn == asn && other.value == value;
    }

    @Override
    public int hashCode() {
        return (asn << 16) | value;
    }

    @Override
    public String toString() {
        return asn + ":" + value;
    }
}
