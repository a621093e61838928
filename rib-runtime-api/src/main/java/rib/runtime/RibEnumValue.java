package rib.runtime;

import java.util.Arrays;

/**
 * 枚举变体值（变体标签 + 负载）
 */
public final class RibEnumValue extends RibValue {

    private static final RibValue[] NO_PAYLOAD = new RibValue[0];

    private final String enumName;
    private final String variantName;
    private final int tag;
    private final RibValue[] payload;

    public RibEnumValue(String enumName, String variantName, int tag, RibValue... payload) {
        this.enumName = enumName;
        this.variantName = variantName;
        this.tag = tag;
        this.payload = payload.length == 0 ? NO_PAYLOAD : payload.clone();
    }

    public String getEnumName() {
        return enumName;
    }

    public String getVariantName() {
        return variantName;
    }

    /** 变体在枚举声明中的下标 */
    public int getTag() {
        return tag;
    }

    public int getPayloadSize() {
        return payload.length;
    }

    public RibValue getPayload(int index) {
        return payload[index];
    }

    @Override
    public String getTypeName() {
        return enumName;
    }

    @Override
    public Object toJavaValue() {
        return variantName;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RibEnumValue)) return false;
        RibEnumValue other = (RibEnumValue) o;
        return other.tag == tag && other.variantName.equals(variantName) && Arrays.equals(other.payload, payload);
    }

    @Override
    public int hashCode() {
        return tag * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        if (payload.length == 0) {
            return enumName + "." + variantName;
        }
        StringBuilder sb = new StringBuilder(enumName).append('.').append(variantName).append('(');
        for (int i = 0; i < payload.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(payload[i]);
        }
        return sb.append(')').toString();
    }
}
