package rib.runtime.vm;

import rib.runtime.HostFunction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 外部调用符号到宿主函数的绑定表
 *
 * <p>符号与外部类型表中的成员一致：字段和方法为 {@code "Route.prefix"}，
 * 自由函数为 {@code "is_bogon"}。同一个 Program 可以与不同的绑定（如测试替身）组合。</p>
 */
public final class HostBindings {

    private final Map<String, HostFunction> functions;

    private HostBindings(Map<String, HostFunction> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HostBindings empty() {
        return new HostBindings(Collections.<String, HostFunction>emptyMap());
    }

    /** 找不到时返回 null */
    public HostFunction get(String symbol) {
        return functions.get(symbol);
    }

    public Set<String> getSymbols() {
        return functions.keySet();
    }

    public static final class Builder {
        private final Map<String, HostFunction> functions = new LinkedHashMap<>();

        Builder() {
        }

        public Builder bind(String symbol, HostFunction function) {
            if (function == null) {
                throw new IllegalArgumentException("Binding for '" + symbol + "' must not be null");
            }
            functions.put(symbol, function);
            return this;
        }

        public HostBindings build() {
            return new HostBindings(functions);
        }
    }
}
