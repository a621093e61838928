package rib.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * IpAddr 值（IPv4 或 IPv6 地址）
 *
 * <p>解析完全在本地完成，不会触发 DNS 查询。</p>
 */
public final class RibIpAddr extends RibValue {

    private final byte[] octets;

    private RibIpAddr(byte[] octets) {
        this.octets = octets;
    }

    /**
     * 由原始字节构造（4 字节为 IPv4，16 字节为 IPv6）
     */
    public static RibIpAddr of(byte[] octets) {
        if (octets.length != 4 && octets.length != 16) {
            throw new IllegalArgumentException("IP address must be 4 or 16 bytes, got " + octets.length);
        }
        return new RibIpAddr(octets.clone());
    }

    /**
     * 解析文本形式的地址
     *
     * @throws IllegalArgumentException 文本不是合法地址
     */
    public static RibIpAddr parse(String text) {
        if (text.indexOf(':') >= 0) {
            return new RibIpAddr(parseV6(text));
        }
        return new RibIpAddr(parseV4(text));
    }

    private static byte[] parseV4(String text) {
        String[] parts = text.split("\\.", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid IPv4 address: " + text);
        }
        byte[] out = new byte[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + text);
            }
            int value = 0;
            for (int j = 0; j < part.length(); j++) {
                char c = part.charAt(j);
                if (c < '0' || c > '9') {
                    throw new IllegalArgumentException("Invalid IPv4 address: " + text);
                }
                value = value * 10 + (c - '0');
            }
            if (value > 255) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + text);
            }
            out[i] = (byte) value;
        }
        return out;
    }

    private static byte[] parseV6(String text) {
        int gap = text.indexOf("::");
        if (gap >= 0 && text.indexOf("::", gap + 1) >= 0) {
            throw new IllegalArgumentException("Invalid IPv6 address: " + text);
        }
        List<Integer> head = groups(gap >= 0 ? text.substring(0, gap) : text, text);
        List<Integer> tail = groups(gap >= 0 ? text.substring(gap + 2) : "", text);
        int total = head.size() + tail.size();
        if ((gap < 0 && total != 8) || (gap >= 0 && total > 7)) {
            throw new IllegalArgumentException("Invalid IPv6 address: " + text);
        }
        byte[] out = new byte[16];
        int index = 0;
        for (int group : head) {
            out[index * 2] = (byte) (group >> 8);
            out[index * 2 + 1] = (byte) group;
            index++;
        }
        index = 8 - tail.size();
        for (int group : tail) {
            out[index * 2] = (byte) (group >> 8);
            out[index * 2 + 1] = (byte) group;
            index++;
        }
        return out;
    }

    private static List<Integer> groups(String part, String text) {
        List<Integer> result = new ArrayList<Integer>();
        if (part.isEmpty()) {
            return result;
        }
        for (String group : part.split(":", -1)) {
            if (group.isEmpty() || group.length() > 4) {
                throw new IllegalArgumentException("Invalid IPv6 address: " + text);
            }
            int value = 0;
            for (int i = 0; i < group.length(); i++) {
                int digit = Character.digit(group.charAt(i), 16);
                if (digit < 0) {
                    throw new IllegalArgumentException("Invalid IPv6 address: " + text);
                }
                value = value * 16 + digit;
            }
            result.add(value);
        }
        return result;
    }

    public boolean isV4() {
        return octets.length == 4;
    }

    public boolean isV6() {
        return octets.length == 16;
    }

    /** 地址位数（32 或 128） */
    public int bitLength() {
        return octets.length * 8;
    }

    public byte[] toByteArray() {
        return octets.clone();
    }

    /** 第 index 位（从最高位开始计数） */
    boolean bit(int index) {
        return (octets[index / 8] & (0x80 >>> (index % 8))) != 0;
    }

    /** 保留前 length 位，其余清零 */
    RibIpAddr mask(int length) {
        byte[] masked = octets.clone();
        for (int i = 0; i < masked.length; i++) {
            int keep = Math.max(0, Math.min(8, length - i * 8));
            masked[i] = (byte) (masked[i] & (0xFF00 >>> keep));
        }
        return new RibIpAddr(masked);
    }

    @Override
    public String getTypeName() {
        return "IpAddr";
    }

    @Override
    public Object toJavaValue() {
        return toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RibIpAddr && Arrays.equals(((RibIpAddr) o).octets, octets);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(octets);
    }

    @Override
    public String toString() {
        if (isV4()) {
            return (octets[0] & 0xFF) + "." + (octets[1] & 0xFF) + "." + (octets[2] & 0xFF) + "." + (octets[3] & 0xFF);
        }
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((octets[i * 2] & 0xFF) << 8) | (octets[i * 2 + 1] & 0xFF);
        }
        // 压缩最长的连续零组（长度至少为 2）
        int bestStart = -1;
        int bestLength = 1;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int j = i;
            while (j < 8 && groups[j] == 0) {
                j++;
            }
            if (j - i > bestLength) {
                bestStart = i;
                bestLength = j - i;
            }
            i = j;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLength - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }
}
