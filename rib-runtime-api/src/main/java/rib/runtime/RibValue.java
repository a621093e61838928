package rib.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * RibLang 运行时值的基类
 *
 * <p>所有值均不可变，可在多个调用之间安全共享。相等性按结构比较，
 * 外部句柄除外（委托给宿主对象的 equals）。</p>
 */
public abstract class RibValue {

    /**
     * 将 Java 值转换为 RibValue（供宿主绑定使用）
     *
     * @param javaValue Java 对象
     * @return 对应的 RibValue
     * @throws IllegalArgumentException 无法映射的 Java 类型
     */
    public static RibValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return RibUnit.UNIT;
        }
        if (javaValue instanceof RibValue) {
            return (RibValue) javaValue;
        }
        if (javaValue instanceof Boolean) {
            return RibBool.of((Boolean) javaValue);
        }
        if (javaValue instanceof Long || javaValue instanceof Integer
                || javaValue instanceof Short || javaValue instanceof Byte) {
            return RibInt.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof String) {
            return RibString.of((String) javaValue);
        }
        if (javaValue instanceof byte[]) {
            return RibBytes.of((byte[]) javaValue);
        }
        if (javaValue instanceof List) {
            List<?> source = (List<?>) javaValue;
            List<RibValue> items = new ArrayList<RibValue>(source.size());
            for (Object item : source) {
                items.add(fromJava(item));
            }
            return RibList.of(items);
        }
        throw new IllegalArgumentException("Cannot convert " + javaValue.getClass().getName() + " to a RibLang value");
    }

    /** 运行时类型名（与源码中的类型名一致） */
    public abstract String getTypeName();

    /** 转换为最接近的 Java 值 */
    public abstract Object toJavaValue();

    public boolean asBool() {
        throw new ClassCastException(getTypeName() + " is not Bool");
    }

    public long asLong() {
        throw new ClassCastException(getTypeName() + " is not Int");
    }
}
