package com.riblang.compiler.analysis.types;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 外部（宿主）类型：只有名称和能力，字段与方法签名由外部类型表登记。按名称比较。
 */
public final class ExternalType extends RibType {

    /** 外部类型可选的能力 */
    public enum Capability {
        /** 支持 == / != 以及 in 列表（委托宿主对象 equals） */
        EQUALITY
    }

    private final String name;
    private final Set<Capability> capabilities;

    public ExternalType(String name, Set<Capability> capabilities) {
        this.name = name;
        this.capabilities = capabilities.isEmpty()
                ? Collections.<Capability>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    public String getName() {
        return name;
    }

    public boolean hasCapability(Capability capability) {
        return capabilities.contains(capability);
    }

    public Set<Capability> getCapabilities() {
        return capabilities;
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
        return visitor.visitExternal(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExternalType)) return false;
        return name.equals(((ExternalType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
