package com.riblang.compiler.analysis;

import com.riblang.compiler.analysis.types.EnumType;
import com.riblang.compiler.analysis.types.ListType;
import com.riblang.compiler.analysis.types.RecordType;
import com.riblang.compiler.analysis.types.RibType;
import com.riblang.compiler.analysis.types.RibTypes;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.decl.Declaration;
import com.riblang.compiler.ast.decl.EnumDecl;
import com.riblang.compiler.ast.decl.Parameter;
import com.riblang.compiler.ast.decl.RecordDecl;
import com.riblang.compiler.ast.type.TypeRef;
import com.riblang.compiler.diagnostic.Diagnostic;
import com.riblang.compiler.diagnostic.DiagnosticKind;
import com.riblang.compiler.diagnostic.Diagnostics;
import com.riblang.compiler.host.ExternalTypeTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 将 AST TypeRef 解析为结构化 RibType
 *
 * <p>查找顺序：内置类型、用户声明的 type / enum、宿主登记的类型。
 * 用户类型按需解析并缓存；解析过程中再次遇到正在解析的类型即为递归类型。</p>
 */
final class TypeResolver {

    private final Diagnostics diagnostics;
    private final ExternalTypeTable typeTable;

    private final Map<String, Declaration> declared = new LinkedHashMap<String, Declaration>();
    private final Map<String, RibType> resolved = new HashMap<String, RibType>();
    private final Set<String> resolving = new HashSet<String>();
    private final Set<String> used = new HashSet<String>();

    TypeResolver(Diagnostics diagnostics, ExternalTypeTable typeTable) {
        this.diagnostics = diagnostics;
        this.typeTable = typeTable;
    }

    /**
     * 登记用户类型声明
     *
     * @return 名称冲突时返回 false（该声明被忽略）
     */
    boolean declare(Declaration decl) {
        String name = decl.getName();
        if (RibTypes.isBuiltinName(name)) {
            diagnostics.error(DiagnosticKind.DUPLICATE_DEFINITION, decl.getNameSpan(),
                    "'" + name + "' is a builtin type");
            return false;
        }
        if (typeTable.findType(name) != null) {
            diagnostics.error(DiagnosticKind.DUPLICATE_DEFINITION, decl.getNameSpan(),
                    "Type '" + name + "' is already registered by the host");
            return false;
        }
        Declaration previous = declared.get(name);
        if (previous != null) {
            diagnostics.report(Diagnostic.error(DiagnosticKind.DUPLICATE_DEFINITION,
                            "Duplicate definition of type '" + name + "'", decl.getNameSpan())
                    .withLabel(previous.getNameSpan(), "first defined here"));
            return false;
        }
        declared.put(name, decl);
        return true;
    }

    /** 解析全部已登记的用户类型（报告递归、重复字段等问题） */
    void resolveAll() {
        for (String name : declared.keySet()) {
            resolveDeclared(name);
        }
    }

    /**
     * 解析类型引用
     *
     * @param owner 出现该引用的类型声明名（用于排除自引用的使用标记），不在类型声明中时为 null
     * @return 无法解析时返回 {@link RibTypes#ERROR}（已报告诊断）
     */
    RibType resolve(TypeRef ref, String owner) {
        String name = ref.getName();
        if (RibTypes.LIST.equals(name)) {
            if (ref.getTypeArgs().size() != 1) {
                diagnostics.error(DiagnosticKind.ARITY_MISMATCH, ref.getSpan(),
                        "Type 'List' expects 1 type argument, found " + ref.getTypeArgs().size());
                return RibTypes.ERROR;
            }
            RibType element = resolve(ref.getTypeArgs().get(0), owner);
            return element == RibTypes.ERROR ? RibTypes.ERROR : new ListType(element);
        }
        if (!ref.getTypeArgs().isEmpty()) {
            diagnostics.error(DiagnosticKind.ARITY_MISMATCH, ref.getSpan(),
                    "Type '" + name + "' takes no type arguments");
            return RibTypes.ERROR;
        }
        RibType builtin = RibTypes.builtin(name);
        if (builtin != null) {
            return builtin;
        }
        if (declared.containsKey(name)) {
            if (!name.equals(owner)) {
                used.add(name);
            }
            if (resolving.contains(name)) {
                diagnostics.error(DiagnosticKind.RECURSIVE_TYPE, ref.getSpan(),
                        "Type '" + name + "' is recursive");
                return RibTypes.ERROR;
            }
            return resolveDeclared(name);
        }
        RibType host = typeTable.findType(name);
        if (host != null) {
            return host;
        }
        diagnostics.error(DiagnosticKind.UNDEFINED_TYPE, ref.getSpan(), "Undefined type '" + name + "'");
        return RibTypes.ERROR;
    }

    /**
     * 按名称查找用户或宿主的命名类型（记录字面量、枚举变体引用）
     *
     * @return 未找到时返回 null，不报告诊断
     */
    RibType findNamed(String name) {
        if (declared.containsKey(name)) {
            used.add(name);
            return resolveDeclared(name);
        }
        return typeTable.findType(name);
    }

    boolean isTypeName(String name) {
        return declared.containsKey(name) || typeTable.findType(name) != null || RibTypes.isBuiltinName(name);
    }

    /**
     * 报告未被引用的用户类型
     */
    void reportUnused() {
        for (Declaration decl : declared.values()) {
            String name = decl.getName();
            if (!used.contains(name) && !name.startsWith("_")) {
                diagnostics.warning(DiagnosticKind.UNUSED_DECLARATION, decl.getNameSpan(),
                        "Unused type '" + name + "'");
            }
        }
    }

    /** 用户声明的类型符号（按声明顺序） */
    List<Symbol> typeSymbols() {
        List<Symbol> symbols = new ArrayList<Symbol>();
        for (Declaration decl : declared.values()) {
            SymbolKind kind = decl instanceof RecordDecl ? SymbolKind.RECORD_TYPE : SymbolKind.ENUM_TYPE;
            Symbol symbol = new Symbol(decl.getName(), kind, resolveDeclared(decl.getName()), decl.getNameSpan(), decl);
            if (used.contains(decl.getName())) {
                symbol.markUsed();
            }
            symbols.add(symbol);
        }
        return symbols;
    }

    // ============ 用户类型解析 ============

    private RibType resolveDeclared(String name) {
        RibType done = resolved.get(name);
        if (done != null) {
            return done;
        }
        Declaration decl = declared.get(name);
        resolving.add(name);
        RibType type;
        if (decl instanceof RecordDecl) {
            type = resolveRecord((RecordDecl) decl);
        } else {
            type = resolveEnum((EnumDecl) decl);
        }
        resolving.remove(name);
        resolved.put(name, type);
        return type;
    }

    private RecordType resolveRecord(RecordDecl decl) {
        Map<String, Span> seen = new HashMap<String, Span>();
        List<RecordType.Field> fields = new ArrayList<RecordType.Field>();
        for (Parameter field : decl.getFields()) {
            RibType fieldType = resolve(field.getType(), decl.getName());
            Span first = seen.get(field.getName());
            if (first != null) {
                diagnostics.report(Diagnostic.error(DiagnosticKind.DUPLICATE_DEFINITION,
                                "Duplicate field '" + field.getName() + "' in type '" + decl.getName() + "'",
                                field.getSpan())
                        .withLabel(first, "first defined here"));
                continue;
            }
            seen.put(field.getName(), field.getSpan());
            fields.add(new RecordType.Field(field.getName(), fieldType));
        }
        return new RecordType(decl.getName(), fields);
    }

    private EnumType resolveEnum(EnumDecl decl) {
        Map<String, Span> seen = new HashMap<String, Span>();
        List<EnumType.Variant> variants = new ArrayList<EnumType.Variant>();
        for (EnumDecl.Variant variant : decl.getVariants()) {
            List<RibType> payload = new ArrayList<RibType>();
            for (TypeRef ref : variant.getPayload()) {
                payload.add(resolve(ref, decl.getName()));
            }
            Span first = seen.get(variant.getName());
            if (first != null) {
                diagnostics.report(Diagnostic.error(DiagnosticKind.DUPLICATE_DEFINITION,
                                "Duplicate variant '" + variant.getName() + "' in enum '" + decl.getName() + "'",
                                variant.getSpan())
                        .withLabel(first, "first defined here"));
                continue;
            }
            seen.put(variant.getName(), variant.getSpan());
            variants.add(new EnumType.Variant(variant.getName(), variants.size(), payload));
        }
        return new EnumType(decl.getName(), variants);
    }
}
