package rib.runtime;

/**
 * Unit 值（无有效值的表达式结果）
 */
public final class RibUnit extends RibValue {

    public static final RibUnit UNIT = new RibUnit();

    private RibUnit() {
    }

    @Override
    public String getTypeName() {
        return "Unit";
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public String toString() {
        return "()";
    }
}
