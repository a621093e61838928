package rib.runtime;

/**
 * Prefix 值（地址 + 前缀长度）
 *
 * <p>构造时主机位被清零，因此 {@code 10.1.2.3/8} 与 {@code 10.0.0.0/8} 相等。</p>
 */
public final class RibPrefix extends RibValue {

    private final RibIpAddr address;
    private final int length;

    private RibPrefix(RibIpAddr address, int length) {
        this.address = address;
        this.length = length;
    }

    public static RibPrefix of(RibIpAddr address, int length) {
        if (length < 0 || length > address.bitLength()) {
            throw new IllegalArgumentException("Prefix length " + length + " out of range for " + address);
        }
        return new RibPrefix(address.mask(length), length);
    }

    /**
     * 解析 {@code addr/len} 形式的前缀
     *
     * @throws IllegalArgumentException 文本不是合法前缀
     */
    public static RibPrefix parse(String text) {
        int slash = text.lastIndexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Prefix is missing '/length': " + text);
        }
        RibIpAddr address = RibIpAddr.parse(text.substring(0, slash));
        String lengthText = text.substring(slash + 1);
        if (lengthText.isEmpty() || lengthText.length() > 3) {
            throw new IllegalArgumentException("Invalid prefix length: " + text);
        }
        int length = 0;
        for (int i = 0; i < lengthText.length(); i++) {
            char c = lengthText.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Invalid prefix length: " + text);
            }
            length = length * 10 + (c - '0');
        }
        return of(address, length);
    }

    public RibIpAddr getAddress() {
        return address;
    }

    public int getLength() {
        return length;
    }

    public boolean isV4() {
        return address.isV4();
    }

    /** 地址是否落在此前缀内 */
    public boolean contains(RibIpAddr ip) {
        if (ip.bitLength() != address.bitLength()) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (ip.bit(i) != address.bit(i)) {
                return false;
            }
        }
        return true;
    }

    /** 此前缀是否覆盖另一个（更长或等长的）前缀 */
    public boolean covers(RibPrefix other) {
        return other.length >= length && contains(other.address);
    }

    @Override
    public String getTypeName() {
        return "Prefix";
    }

    @Override
    public Object toJavaValue() {
        return toString();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RibPrefix)) return false;
        RibPrefix other = (RibPrefix) o;
        return other.length == length && other.address.equals(address);
    }

    @Override
    public int hashCode() {
        return address.hashCode() * 31 + length;
    }

    @Override
    public String toString() {
        return address + "/" + length;
    }
}
