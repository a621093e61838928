package com.riblang.compiler.analysis.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内置类型常量与按名查找
 */
public final class RibTypes {

    public static final PrimitiveType BOOL = new PrimitiveType("Bool");
    public static final PrimitiveType INT = new PrimitiveType("Int");
    public static final PrimitiveType STRING = new PrimitiveType("String");
    public static final PrimitiveType BYTES = new PrimitiveType("Bytes");
    public static final PrimitiveType PREFIX = new PrimitiveType("Prefix");
    public static final PrimitiveType IP_ADDR = new PrimitiveType("IpAddr");
    public static final PrimitiveType ASN = new PrimitiveType("Asn");
    public static final PrimitiveType COMMUNITY = new PrimitiveType("Community");
    public static final PrimitiveType AS_PATH = new PrimitiveType("AsPath");

    public static final UnitType UNIT = UnitType.INSTANCE;
    public static final NeverType NEVER = NeverType.INSTANCE;
    public static final ErrorType ERROR = ErrorType.INSTANCE;

    /** 泛型内置类型名 */
    public static final String LIST = "List";

    private static final Map<String, RibType> BUILTINS;

    static {
        Map<String, RibType> map = new LinkedHashMap<String, RibType>();
        for (RibType t : new RibType[] {BOOL, INT, STRING, BYTES, PREFIX, IP_ADDR, ASN, COMMUNITY, AS_PATH, UNIT}) {
            map.put(t.getTypeName(), t);
        }
        BUILTINS = Collections.unmodifiableMap(map);
    }

    private RibTypes() {
    }

    /**
     * 按名称查找非泛型内置类型
     *
     * @return 不是内置类型名时返回 null
     */
    public static RibType builtin(String name) {
        return BUILTINS.get(name);
    }

    /** 是否为保留的内置类型名（含 List） */
    public static boolean isBuiltinName(String name) {
        return BUILTINS.containsKey(name) || LIST.equals(name);
    }
}
