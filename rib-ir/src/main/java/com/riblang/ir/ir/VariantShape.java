package com.riblang.ir.ir;

/**
 * 枚举变体构造的布局。
 */
public final class VariantShape {

    private final String enumName;
    private final String variantName;
    private final int tag;
    private final int payloadSize;

    public VariantShape(String enumName, String variantName, int tag, int payloadSize) {
        this.enumName = enumName;
        this.variantName = variantName;
        this.tag = tag;
        this.payloadSize = payloadSize;
    }

    public String getEnumName() { return enumName; }
    public String getVariantName() { return variantName; }
    public int getTag() { return tag; }
    public int getPayloadSize() { return payloadSize; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariantShape)) return false;
        VariantShape that = (VariantShape) o;
        return tag == that.tag && payloadSize == that.payloadSize
                && enumName.equals(that.enumName) && variantName.equals(that.variantName);
    }

    @Override
    public int hashCode() {
        return (enumName.hashCode() * 31 + variantName.hashCode()) * 31 + tag;
    }

    @Override
    public String toString() {
        return enumName + "." + variantName + "#" + tag + "/" + payloadSize;
    }
}
