package rib.runtime.vm;

import rib.runtime.RibValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单次调用的输入：按参数名提供入口函数的参数值。
 */
public final class RuntimeContext {

    private final Map<String, RibValue> inputs;

    private RuntimeContext(Map<String, RibValue> inputs) {
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RuntimeContext empty() {
        return new RuntimeContext(Collections.<String, RibValue>emptyMap());
    }

    /** 找不到时返回 null */
    public RibValue getInput(String name) {
        return inputs.get(name);
    }

    public Map<String, RibValue> getInputs() {
        return inputs;
    }

    public static final class Builder {
        private final Map<String, RibValue> inputs = new LinkedHashMap<>();

        Builder() {
        }

        public Builder input(String name, RibValue value) {
            if (value == null) {
                throw new IllegalArgumentException("Input '" + name + "' must not be null");
            }
            inputs.put(name, value);
            return this;
        }

        public RuntimeContext build() {
            return new RuntimeContext(inputs);
        }
    }
}
