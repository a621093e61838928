package com.riblang.ir.bytecode;

import rib.runtime.RibValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 去重的常量池：相等的值共享同一个下标，下标按首次出现的顺序分配。
 */
public class ConstantPool {

    private final List<RibValue> values = new ArrayList<>();
    private final Map<RibValue, Integer> indices = new HashMap<>();

    public int intern(RibValue value) {
        Integer index = indices.get(value);
        if (index == null) {
            index = values.size();
            values.add(value);
            indices.put(value, index);
        }
        return index;
    }

    public int size() {
        return values.size();
    }

    public List<RibValue> toList() {
        return new ArrayList<>(values);
    }
}
