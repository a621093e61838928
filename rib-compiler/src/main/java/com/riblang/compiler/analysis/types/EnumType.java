package com.riblang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 枚举类型：变体按声明顺序编号（标签），每个变体可携带负载
 */
public final class EnumType extends RibType {

    /**
     * 枚举变体
     */
    public static final class Variant {
        private final String name;
        private final int tag;
        private final List<RibType> payload;

        public Variant(String name, int tag, List<RibType> payload) {
            this.name = name;
            this.tag = tag;
            this.payload = Collections.unmodifiableList(new ArrayList<RibType>(payload));
        }

        public String getName() {
            return name;
        }

        public int getTag() {
            return tag;
        }

        public List<RibType> getPayload() {
            return payload;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Variant)) return false;
            Variant that = (Variant) o;
            return tag == that.tag && name.equals(that.name) && payload.equals(that.payload);
        }

        @Override
        public int hashCode() {
            return name.hashCode() * 31 + payload.hashCode();
        }
    }

    private final String name;
    private final List<Variant> variants;

    public EnumType(String name, List<Variant> variants) {
        this.name = name;
        this.variants = Collections.unmodifiableList(new ArrayList<Variant>(variants));
    }

    public String getName() {
        return name;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    public Variant findVariant(String variantName) {
        for (Variant v : variants) {
            if (v.getName().equals(variantName)) {
                return v;
            }
        }
        return null;
    }

    @Override
    public String getTypeName() {
        return name;
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(RibTypeVisitor<R> visitor) {
        return visitor.visitEnum(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumType)) return false;
        return variants.equals(((EnumType) o).variants);
    }

    @Override
    public int hashCode() {
        return variants.hashCode();
    }
}
