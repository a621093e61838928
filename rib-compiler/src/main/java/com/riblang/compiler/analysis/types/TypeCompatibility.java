package com.riblang.compiler.analysis.types;

/**
 * 类型兼容性规则
 *
 * <p>没有隐式转换：除 Never（可赋给任何类型）和错误类型（抑制级联）外，
 * 只有相等的类型才能互相赋值。</p>
 */
public final class TypeCompatibility {

    private TypeCompatibility() {
    }

    /**
     * source 类型的值能否用在期望 target 类型的位置
     */
    public static boolean isAssignable(RibType target, RibType source) {
        if (isError(target) || isError(source)) {
            return true;
        }
        if (source instanceof NeverType) {
            return true;
        }
        return target.equals(source);
    }

    public static boolean isError(RibType type) {
        return type instanceof ErrorType;
    }

    /**
     * 计算两个分支类型的汇合类型；无法汇合时返回 null
     */
    public static RibType join(RibType a, RibType b) {
        if (isError(a) || isError(b)) {
            return RibTypes.ERROR;
        }
        if (a instanceof NeverType) return b;
        if (b instanceof NeverType) return a;
        return a.equals(b) ? a : null;
    }

    /**
     * 是否支持 == / != 比较
     */
    public static boolean supportsEquality(RibType type) {
        return type.accept(EQUALITY);
    }

    /**
     * 是否支持 &lt; &lt;= &gt; &gt;= 比较
     */
    public static boolean isOrdered(RibType type) {
        return type.equals(RibTypes.INT) || type.equals(RibTypes.ASN);
    }

    private static final RibTypeVisitor<Boolean> EQUALITY = new RibTypeVisitor<Boolean>() {
        @Override
        public Boolean visitPrimitive(PrimitiveType type) {
            return true;
        }

        @Override
        public Boolean visitUnit(UnitType type) {
            return true;
        }

        @Override
        public Boolean visitNever(NeverType type) {
            return true;
        }

        @Override
        public Boolean visitRecord(RecordType type) {
            for (RecordType.Field field : type.getFields()) {
                if (!field.getType().accept(this)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitEnum(EnumType type) {
            for (EnumType.Variant variant : type.getVariants()) {
                for (RibType payload : variant.getPayload()) {
                    if (!payload.accept(this)) {
                        return false;
                    }
                }
            }
            return true;
        }

        @Override
        public Boolean visitList(ListType type) {
            return type.getElementType().accept(this);
        }

        @Override
        public Boolean visitFunction(FunctionType type) {
            return false;
        }

        @Override
        public Boolean visitExternal(ExternalType type) {
            return type.hasCapability(ExternalType.Capability.EQUALITY);
        }

        @Override
        public Boolean visitError(ErrorType type) {
            return true;
        }
    };
}
