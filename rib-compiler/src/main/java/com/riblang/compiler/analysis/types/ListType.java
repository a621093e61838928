package com.riblang.compiler.analysis.types;

/**
 * 列表类型 List&lt;T&gt;
 */
public final class ListType extends RibType {

    private final RibType elementType;

    public ListType(RibType elementType) {
        this.elementType = elementType;
    }

    public RibType getElementType() {
        return elementType;
    }

    @Override
    public String getTypeName() {
        return "List";
    }

    @Override
    public String toDisplayString() {
        return "List<" + elementType.toDisplayString() + ">";
    }

    @Override
    public <R> R accept(RibTypeVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListType)) return false;
        return elementType.equals(((ListType) o).elementType);
    }

    @Override
    public int hashCode() {
        return 31 + elementType.hashCode();
    }
}
