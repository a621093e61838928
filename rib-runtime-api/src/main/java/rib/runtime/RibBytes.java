package rib.runtime;

import java.util.Arrays;

/**
 * Bytes 值（不可变字节序列，例如 BGP 属性原始内容）
 */
public final class RibBytes extends RibValue {

    public static RibBytes of(byte[] bytes) {
        return new RibBytes(bytes.clone());
    }

    private final byte[] bytes;

    private RibBytes(byte[] bytes) {
        this.bytes = bytes;
    }

    public int length() {
        return bytes.length;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public String getTypeName() {
        return "Bytes";
    }

    @Override
    public Object toJavaValue() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RibBytes && Arrays.equals(((RibBytes) o).bytes, bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("0x");
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xFF));
        }
        return sb.toString();
    }
}
