package com.riblang.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域
 *
 * <p>父作用域以 {@link ScopeArena} 中的下标引用，不持有父对象。</p>
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 顶层声明
        FUNCTION,   // 参数
        BLOCK,      // { ... }
        ARM,        // match 分支绑定
        LOOP        // for 循环变量
    }

    public static final int NO_PARENT = -1;

    private final int index;
    private final int parent;
    private final ScopeType type;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();
    // 同一作用域内的遮蔽会替换 symbols 中的条目，这里保留全部声明用于未使用检查
    private final List<Symbol> declared = new ArrayList<Symbol>();

    Scope(int index, int parent, ScopeType type) {
        this.index = index;
        this.parent = parent;
        this.type = type;
    }

    public int getIndex() { return index; }
    public int getParent() { return parent; }
    public ScopeType getType() { return type; }

    /**
     * 注册符号到当前作用域
     *
     * @return 当前作用域中被遮蔽的同名符号，没有时返回 null
     */
    Symbol define(Symbol symbol) {
        declared.add(symbol);
        return symbols.put(symbol.getName(), symbol);
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 按声明顺序返回全部符号（含被遮蔽的） */
    public List<Symbol> getDeclared() {
        return Collections.unmodifiableList(declared);
    }
}
