package com.riblang.compiler.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * 作用域池
 *
 * <p>所有作用域按创建顺序存放在一个列表里，作用域之间通过下标关联。
 * 函数体检查前 {@link #mark()}，检查完成后 {@link #release(int)}，
 * 该函数创建的所有局部作用域随之释放。</p>
 */
public final class ScopeArena {

    private final List<Scope> scopes = new ArrayList<Scope>();
    private int current = Scope.NO_PARENT;

    public ScopeArena() {
        push(Scope.ScopeType.GLOBAL);
    }

    /** 进入新作用域，返回其下标 */
    public int push(Scope.ScopeType type) {
        Scope scope = new Scope(scopes.size(), current, type);
        scopes.add(scope);
        current = scope.getIndex();
        return current;
    }

    /** 退出当前作用域，返回被退出的作用域 */
    public Scope pop() {
        Scope scope = scopes.get(current);
        if (scope.getParent() == Scope.NO_PARENT) {
            throw new IllegalStateException("Cannot pop the global scope");
        }
        current = scope.getParent();
        return scope;
    }

    public Scope current() {
        return scopes.get(current);
    }

    public Scope global() {
        return scopes.get(0);
    }

    public Scope get(int index) {
        return scopes.get(index);
    }

    public Symbol define(Symbol symbol) {
        return current().define(symbol);
    }

    /** 从当前作用域逐级向外查找，最近的声明优先 */
    public Symbol resolve(String name) {
        int index = current;
        while (index != Scope.NO_PARENT) {
            Scope scope = scopes.get(index);
            Symbol symbol = scope.resolveLocal(name);
            if (symbol != null) {
                return symbol;
            }
            index = scope.getParent();
        }
        return null;
    }

    public int mark() {
        return scopes.size();
    }

    /**
     * 释放 mark 之后创建的全部作用域
     */
    public void release(int mark) {
        if (current >= mark) {
            throw new IllegalStateException("Scope " + current + " is still active");
        }
        while (scopes.size() > mark) {
            scopes.remove(scopes.size() - 1);
        }
    }

    /** 当前存活的作用域数量 */
    public int size() {
        return scopes.size();
    }
}
