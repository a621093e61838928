package com.riblang.compiler.analysis;

import com.riblang.compiler.analysis.types.EnumType;
import com.riblang.compiler.analysis.types.RibType;
import com.riblang.compiler.host.ExternalMember;
import rib.runtime.BuiltinMethod;

/**
 * 调用表达式的解析结果
 */
public final class CallTarget {

    public enum Kind {
        FUNCTION,   // 用户函数
        EXTERNAL,   // 宿主方法或宿主函数
        BUILTIN,    // 基础类型的内置方法
        VARIANT     // 带负载的枚举变体构造
    }

    private final Kind kind;
    private final Symbol function;
    private final ExternalMember external;
    private final BuiltinMethod builtin;
    private final EnumType enumType;
    private final EnumType.Variant variant;
    private final RibType returnType;

    private CallTarget(Kind kind, Symbol function, ExternalMember external, BuiltinMethod builtin,
                       EnumType enumType, EnumType.Variant variant, RibType returnType) {
        this.kind = kind;
        this.function = function;
        this.external = external;
        this.builtin = builtin;
        this.enumType = enumType;
        this.variant = variant;
        this.returnType = returnType;
    }

    public static CallTarget function(Symbol function, RibType returnType) {
        return new CallTarget(Kind.FUNCTION, function, null, null, null, null, returnType);
    }

    public static CallTarget external(ExternalMember member) {
        return new CallTarget(Kind.EXTERNAL, null, member, null, null, null, member.getReturnType());
    }

    public static CallTarget builtin(BuiltinMethod method, RibType returnType) {
        return new CallTarget(Kind.BUILTIN, null, null, method, null, null, returnType);
    }

    public static CallTarget variant(EnumType enumType, EnumType.Variant variant) {
        return new CallTarget(Kind.VARIANT, null, null, null, enumType, variant, enumType);
    }

    public Kind getKind() { return kind; }
    public Symbol getFunction() { return function; }
    public ExternalMember getExternal() { return external; }
    public BuiltinMethod getBuiltin() { return builtin; }
    public EnumType getEnumType() { return enumType; }
    public EnumType.Variant getVariant() { return variant; }
    public RibType getReturnType() { return returnType; }

    /** 被调用者表达式（{@code a.m(...)} 中的 a）是否作为第一个参数求值 */
    public boolean hasReceiver() {
        switch (kind) {
            case BUILTIN:
                return true;
            case EXTERNAL:
                return external.getKind() == ExternalMember.Kind.METHOD;
            default:
                return false;
        }
    }
}
