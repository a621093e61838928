package rib.runtime;

/**
 * 基础类型上的内置方法
 *
 * <p>类型以源码中的名称描述；{@code List} 接收者的元素类型记为 {@link #ELEMENT}。
 * 编译器据此做类型检查，虚拟机直接调用 {@link #invoke}。所有实现对合法类型的输入都是全函数。</p>
 */
public enum BuiltinMethod {

    // ============ Prefix ============

    PREFIX_LEN("Prefix", "len", "Int") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibInt.of(((RibPrefix) receiver).getLength());
        }
    },
    PREFIX_ADDRESS("Prefix", "address", "IpAddr") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return ((RibPrefix) receiver).getAddress();
        }
    },
    PREFIX_IS_V4("Prefix", "is_v4", "Bool") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibPrefix) receiver).isV4());
        }
    },
    PREFIX_CONTAINS("Prefix", "contains", "Bool", "IpAddr") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibPrefix) receiver).contains((RibIpAddr) args[0]));
        }
    },
    PREFIX_COVERS("Prefix", "covers", "Bool", "Prefix") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibPrefix) receiver).covers((RibPrefix) args[0]));
        }
    },

    // ============ IpAddr ============

    IP_IS_V4("IpAddr", "is_v4", "Bool") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibIpAddr) receiver).isV4());
        }
    },
    IP_IS_V6("IpAddr", "is_v6", "Bool") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibIpAddr) receiver).isV6());
        }
    },

    // ============ Asn / Community ============

    ASN_VALUE("Asn", "value", "Int") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibInt.of(((RibAsn) receiver).getValue());
        }
    },
    COMMUNITY_ASN("Community", "asn", "Int") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibInt.of(((RibCommunity) receiver).getAsn());
        }
    },
    COMMUNITY_VALUE("Community", "value", "Int") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibInt.of(((RibCommunity) receiver).getValue());
        }
    },

    // ============ AsPath ============

    AS_PATH_LEN("AsPath", "len", "Int") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibInt.of(((RibAsPath) receiver).length());
        }
    },
    AS_PATH_ORIGIN("AsPath", "origin", "Asn") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return ((RibAsPath) receiver).origin();
        }
    },
    AS_PATH_FIRST("AsPath", "first", "Asn") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return ((RibAsPath) receiver).first();
        }
    },
    AS_PATH_CONTAINS("AsPath", "contains", "Bool", "Asn") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibAsPath) receiver).contains((RibAsn) args[0]));
        }
    },

    // ============ String / Bytes ============

    STRING_LEN("String", "len", "Int") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibInt.of(((RibString) receiver).length());
        }
    },
    STRING_CONTAINS("String", "contains", "Bool", "String") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibString) receiver).getValue().contains(((RibString) args[0]).getValue()));
        }
    },
    STRING_STARTS_WITH("String", "starts_with", "Bool", "String") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibString) receiver).getValue().startsWith(((RibString) args[0]).getValue()));
        }
    },
    BYTES_LEN("Bytes", "len", "Int") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibInt.of(((RibBytes) receiver).length());
        }
    },

    // ============ List ============

    LIST_LEN("List", "len", "Int") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibInt.of(((RibList) receiver).size());
        }
    },
    LIST_IS_EMPTY("List", "is_empty", "Bool") {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibList) receiver).size() == 0);
        }
    },
    LIST_CONTAINS("List", "contains", "Bool", BuiltinMethod.ELEMENT) {
        @Override
        public RibValue invoke(RibValue receiver, RibValue[] args) {
            return RibBool.of(((RibList) receiver).contains(args[0]));
        }
    };

    /** List 接收者的元素类型占位符 */
    public static final String ELEMENT = "$E";

    private final String receiverType;
    private final String methodName;
    private final String returnType;
    private final String[] parameterTypes;

    BuiltinMethod(String receiverType, String methodName, String returnType, String... parameterTypes) {
        this.receiverType = receiverType;
        this.methodName = methodName;
        this.returnType = returnType;
        this.parameterTypes = parameterTypes;
    }

    /**
     * 查找内置方法
     *
     * @param receiverType 接收者类型名（列表统一为 "List"）
     * @return 找不到时返回 null
     */
    public static BuiltinMethod find(String receiverType, String methodName) {
        for (BuiltinMethod method : values()) {
            if (method.receiverType.equals(receiverType) && method.methodName.equals(methodName)) {
                return method;
            }
        }
        return null;
    }

    public String getReceiverType() {
        return receiverType;
    }

    public String getMethodName() {
        return methodName;
    }

    public String getReturnType() {
        return returnType;
    }

    public int getParameterCount() {
        return parameterTypes.length;
    }

    public String getParameterType(int index) {
        return parameterTypes[index];
    }

    /** 符号名，例如 {@code Prefix.len} */
    public String getSymbol() {
        return receiverType + "." + methodName;
    }

    /**
     * 调用内置方法
     *
     * @param receiver 接收者
     * @param args     参数（不含接收者）
     */
    public abstract RibValue invoke(RibValue receiver, RibValue[] args);
}
