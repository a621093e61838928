package com.riblang.compiler.host;

import com.riblang.compiler.analysis.types.EnumType;
import com.riblang.compiler.analysis.types.ExternalType;
import com.riblang.compiler.analysis.types.ListType;
import com.riblang.compiler.analysis.types.RecordType;
import com.riblang.compiler.analysis.types.RibType;
import com.riblang.compiler.analysis.types.RibTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 宿主登记的外部类型表（构建后不可变，可被多个编译单元并发共享）
 *
 * <pre>
 * ExternalTypeTable table = ExternalTypeTable.builder()
 *         .enumType("RouteStatus", "InConvergence", "UpToDate", "Withdrawn")
 *         .type("Route")
 *             .field("prefix", "Prefix")
 *             .field("communities", "List&lt;Community&gt;")
 *             .method("has_community", "Bool", "Community")
 *             .done()
 *         .function("is_bogon", "Bool", "Prefix")
 *         .build();
 * </pre>
 */
public final class ExternalTypeTable {

    public static final ExternalTypeTable EMPTY = builder().build();

    private final Map<String, RibType> types;
    private final Map<String, Map<String, ExternalMember>> fields;
    private final Map<String, Map<String, ExternalMember>> methods;
    private final Map<String, ExternalMember> functions;

    private ExternalTypeTable(Map<String, RibType> types,
                              Map<String, Map<String, ExternalMember>> fields,
                              Map<String, Map<String, ExternalMember>> methods,
                              Map<String, ExternalMember> functions) {
        this.types = Collections.unmodifiableMap(types);
        this.fields = Collections.unmodifiableMap(fields);
        this.methods = Collections.unmodifiableMap(methods);
        this.functions = Collections.unmodifiableMap(functions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 按名称查找登记的类型（外部类型、记录或枚举），未登记时返回 null */
    public RibType findType(String name) {
        return types.get(name);
    }

    public ExternalMember findField(String typeName, String fieldName) {
        Map<String, ExternalMember> members = fields.get(typeName);
        return members != null ? members.get(fieldName) : null;
    }

    public ExternalMember findMethod(String typeName, String methodName) {
        Map<String, ExternalMember> members = methods.get(typeName);
        return members != null ? members.get(methodName) : null;
    }

    public ExternalMember findFunction(String name) {
        return functions.get(name);
    }

    /** 已登记的全部类型名 */
    public Set<String> getTypeNames() {
        return types.keySet();
    }

    public Map<String, ExternalMember> getFunctions() {
        return functions;
    }

    /**
     * 登记错误（重复名称、未知类型等）
     */
    public static class RegistrationException extends RuntimeException {
        public RegistrationException(String message) {
            super(message);
        }
    }

    // ============ 构建器 ============

    /**
     * 外部类型表构建器。签名中的类型以源码语法书写，在 {@link #build()} 时统一解析，
     * 因此登记顺序无关。
     */
    public static final class Builder {
        private final Map<String, TypeBuilder> externalTypes = new LinkedHashMap<String, TypeBuilder>();
        private final Map<String, RecordBuilder> records = new LinkedHashMap<String, RecordBuilder>();
        private final Map<String, EnumBuilder> enums = new LinkedHashMap<String, EnumBuilder>();
        private final Map<String, Signature> functions = new LinkedHashMap<String, Signature>();
        private boolean built;

        private Builder() {
        }

        public TypeBuilder type(String name) {
            checkNewTypeName(name);
            TypeBuilder builder = new TypeBuilder(this, name);
            externalTypes.put(name, builder);
            return builder;
        }

        public RecordBuilder record(String name) {
            checkNewTypeName(name);
            RecordBuilder builder = new RecordBuilder(this, name);
            records.put(name, builder);
            return builder;
        }

        public EnumBuilder enumType(String name) {
            checkNewTypeName(name);
            EnumBuilder builder = new EnumBuilder(this, name);
            enums.put(name, builder);
            return builder;
        }

        /** 登记无负载的枚举 */
        public Builder enumType(String name, String... variants) {
            EnumBuilder builder = enumType(name);
            for (String variant : variants) {
                builder.variant(variant);
            }
            return builder.done();
        }

        public Builder function(String name, String returnType, String... paramTypes) {
            checkNotBuilt();
            if (functions.containsKey(name)) {
                throw new RegistrationException("Duplicate external function '" + name + "'");
            }
            functions.put(name, new Signature(name, returnType, paramTypes));
            return this;
        }

        private void checkNotBuilt() {
            if (built) {
                throw new RegistrationException("External type table is already built");
            }
        }

        private void checkNewTypeName(String name) {
            checkNotBuilt();
            if (RibTypes.isBuiltinName(name)) {
                throw new RegistrationException("'" + name + "' is a builtin type name");
            }
            if (externalTypes.containsKey(name) || records.containsKey(name) || enums.containsKey(name)) {
                throw new RegistrationException("Duplicate external type '" + name + "'");
            }
        }

        /**
         * 解析所有签名并冻结
         *
         * @throws RegistrationException 签名引用了未登记的类型，或记录类型递归
         */
        public ExternalTypeTable build() {
            built = true;
            Map<String, RibType> types = new LinkedHashMap<String, RibType>();
            for (TypeBuilder t : externalTypes.values()) {
                types.put(t.name, new ExternalType(t.name, t.capabilities));
            }
            Resolver resolver = new Resolver(types);
            for (String name : records.keySet()) {
                resolver.resolveNamed(name);
            }
            for (String name : enums.keySet()) {
                resolver.resolveNamed(name);
            }

            Map<String, Map<String, ExternalMember>> fieldTable = new LinkedHashMap<String, Map<String, ExternalMember>>();
            Map<String, Map<String, ExternalMember>> methodTable = new LinkedHashMap<String, Map<String, ExternalMember>>();
            for (TypeBuilder t : externalTypes.values()) {
                Map<String, ExternalMember> typeFields = new LinkedHashMap<String, ExternalMember>();
                for (Signature s : t.fields.values()) {
                    typeFields.put(s.name, resolver.member(ExternalMember.Kind.FIELD, t.name, s));
                }
                Map<String, ExternalMember> typeMethods = new LinkedHashMap<String, ExternalMember>();
                for (Signature s : t.methods.values()) {
                    typeMethods.put(s.name, resolver.member(ExternalMember.Kind.METHOD, t.name, s));
                }
                fieldTable.put(t.name, Collections.unmodifiableMap(typeFields));
                methodTable.put(t.name, Collections.unmodifiableMap(typeMethods));
            }
            Map<String, ExternalMember> functionTable = new LinkedHashMap<String, ExternalMember>();
            for (Signature s : functions.values()) {
                functionTable.put(s.name, resolver.member(ExternalMember.Kind.FUNCTION, null, s));
            }
            return new ExternalTypeTable(types, fieldTable, methodTable, functionTable);
        }

        /**
         * 类型字符串解析（带记录/枚举的惰性解析与递归检测）
         */
        private final class Resolver {
            private final Map<String, RibType> types;
            private final Set<String> resolving = new HashSet<String>();

            Resolver(Map<String, RibType> types) {
                this.types = types;
            }

            ExternalMember member(ExternalMember.Kind kind, String owner, Signature s) {
                String where = owner != null ? owner + "." + s.name : s.name;
                List<RibType> params = new ArrayList<RibType>();
                for (String p : s.paramTypes) {
                    params.add(resolve(p.trim(), where));
                }
                return new ExternalMember(kind, owner, s.name, params, resolve(s.returnType.trim(), where));
            }

            RibType resolve(String text, String where) {
                if (text.endsWith(">")) {
                    int open = text.indexOf('<');
                    if (open < 0 || !RibTypes.LIST.equals(text.substring(0, open).trim())) {
                        throw new RegistrationException("Unknown generic type '" + text + "' in " + where);
                    }
                    return new ListType(resolve(text.substring(open + 1, text.length() - 1).trim(), where));
                }
                RibType builtin = RibTypes.builtin(text);
                if (builtin != null) {
                    return builtin;
                }
                if (types.containsKey(text) || records.containsKey(text) || enums.containsKey(text)) {
                    return resolveNamed(text);
                }
                throw new RegistrationException("Unknown type '" + text + "' in " + where);
            }

            RibType resolveNamed(String name) {
                RibType existing = types.get(name);
                if (existing != null) {
                    return existing;
                }
                if (!resolving.add(name)) {
                    throw new RegistrationException("Recursive type '" + name + "'");
                }
                RibType result;
                if (records.containsKey(name)) {
                    List<RecordType.Field> recordFields = new ArrayList<RecordType.Field>();
                    for (Map.Entry<String, String> f : records.get(name).fields.entrySet()) {
                        recordFields.add(new RecordType.Field(f.getKey(), resolve(f.getValue().trim(), name + "." + f.getKey())));
                    }
                    result = new RecordType(name, recordFields);
                } else {
                    EnumBuilder e = enums.get(name);
                    List<EnumType.Variant> variants = new ArrayList<EnumType.Variant>();
                    int tag = 0;
                    for (Map.Entry<String, String[]> v : e.variants.entrySet()) {
                        List<RibType> payload = new ArrayList<RibType>();
                        for (String p : v.getValue()) {
                            payload.add(resolve(p.trim(), name + "." + v.getKey()));
                        }
                        variants.add(new EnumType.Variant(v.getKey(), tag++, payload));
                    }
                    result = new EnumType(name, variants);
                }
                resolving.remove(name);
                types.put(name, result);
                return result;
            }
        }
    }

    /** 未解析的签名 */
    private static final class Signature {
        final String name;
        final String returnType;
        final String[] paramTypes;

        Signature(String name, String returnType, String[] paramTypes) {
            this.name = name;
            this.returnType = returnType;
            this.paramTypes = paramTypes.clone();
        }
    }

    /**
     * 外部类型构建器
     */
    public static final class TypeBuilder {
        private final Builder parent;
        private final String name;
        private final Map<String, Signature> fields = new LinkedHashMap<String, Signature>();
        private final Map<String, Signature> methods = new LinkedHashMap<String, Signature>();
        private final Set<ExternalType.Capability> capabilities = EnumSet.noneOf(ExternalType.Capability.class);

        private TypeBuilder(Builder parent, String name) {
            this.parent = parent;
            this.name = name;
        }

        public TypeBuilder field(String fieldName, String type) {
            if (fields.containsKey(fieldName) || methods.containsKey(fieldName)) {
                throw new RegistrationException("Duplicate member '" + name + "." + fieldName + "'");
            }
            fields.put(fieldName, new Signature(fieldName, type, new String[0]));
            return this;
        }

        public TypeBuilder method(String methodName, String returnType, String... paramTypes) {
            if (fields.containsKey(methodName) || methods.containsKey(methodName)) {
                throw new RegistrationException("Duplicate member '" + name + "." + methodName + "'");
            }
            methods.put(methodName, new Signature(methodName, returnType, paramTypes));
            return this;
        }

        public TypeBuilder capability(ExternalType.Capability capability) {
            capabilities.add(capability);
            return this;
        }

        public Builder done() {
            return parent;
        }
    }

    /**
     * 宿主记录类型构建器
     */
    public static final class RecordBuilder {
        private final Builder parent;
        private final String name;
        private final Map<String, String> fields = new LinkedHashMap<String, String>();

        private RecordBuilder(Builder parent, String name) {
            this.parent = parent;
            this.name = name;
        }

        public RecordBuilder field(String fieldName, String type) {
            if (fields.put(fieldName, type) != null) {
                throw new RegistrationException("Duplicate field '" + name + "." + fieldName + "'");
            }
            return this;
        }

        public Builder done() {
            return parent;
        }
    }

    /**
     * 宿主枚举类型构建器
     */
    public static final class EnumBuilder {
        private final Builder parent;
        private final String name;
        private final Map<String, String[]> variants = new LinkedHashMap<String, String[]>();

        private EnumBuilder(Builder parent, String name) {
            this.parent = parent;
            this.name = name;
        }

        public EnumBuilder variant(String variantName, String... payloadTypes) {
            if (variants.put(variantName, payloadTypes.clone()) != null) {
                throw new RegistrationException("Duplicate variant '" + name + "." + variantName + "'");
            }
            return this;
        }

        public Builder done() {
            return parent;
        }
    }
}
