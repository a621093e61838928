package com.riblang.compiler.host;

import com.riblang.compiler.analysis.types.RibType;

import java.util.Collections;
import java.util.List;

/**
 * 外部类型表中登记的可调用成员：字段读取、方法或自由函数
 *
 * <p>字段和方法在调用时把接收者作为第一个参数传给宿主函数。</p>
 */
public final class ExternalMember {

    public enum Kind {
        FIELD,
        METHOD,
        FUNCTION
    }

    private final Kind kind;
    private final String ownerType;          // 自由函数为 null
    private final String name;
    private final List<RibType> paramTypes;  // 不含接收者
    private final RibType returnType;

    ExternalMember(Kind kind, String ownerType, String name, List<RibType> paramTypes, RibType returnType) {
        this.kind = kind;
        this.ownerType = ownerType;
        this.name = name;
        this.paramTypes = Collections.unmodifiableList(paramTypes);
        this.returnType = returnType;
    }

    public Kind getKind() {
        return kind;
    }

    public String getOwnerType() {
        return ownerType;
    }

    public String getName() {
        return name;
    }

    public List<RibType> getParamTypes() {
        return paramTypes;
    }

    public RibType getReturnType() {
        return returnType;
    }

    /** 宿主绑定使用的符号名：{@code Route.prefix} 或 {@code is_bogon} */
    public String getSymbol() {
        return ownerType != null ? ownerType + "." + name : name;
    }

    /** 实际传给宿主函数的参数个数（含接收者） */
    public int getHostArity() {
        return ownerType != null ? paramTypes.size() + 1 : paramTypes.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getSymbol());
        if (kind == Kind.FIELD) {
            return sb.append(": ").append(returnType.toDisplayString()).toString();
        }
        sb.append('(');
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toDisplayString());
        }
        return sb.append(") -> ").append(returnType.toDisplayString()).toString();
    }
}
