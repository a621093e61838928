package rib.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * List 值（不可变，元素类型一致）
 */
public final class RibList extends RibValue {

    public static final RibList EMPTY = new RibList(Collections.<RibValue>emptyList());

    public static RibList of(List<? extends RibValue> items) {
        return items.isEmpty() ? EMPTY : new RibList(Collections.unmodifiableList(new ArrayList<RibValue>(items)));
    }

    public static RibList of(RibValue... items) {
        List<RibValue> list = new ArrayList<RibValue>(items.length);
        Collections.addAll(list, items);
        return of(list);
    }

    private final List<RibValue> items;

    private RibList(List<RibValue> items) {
        this.items = items;
    }

    public List<RibValue> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public RibValue get(int index) {
        return items.get(index);
    }

    public boolean contains(RibValue value) {
        return items.contains(value);
    }

    @Override
    public String getTypeName() {
        return "List";
    }

    @Override
    public Object toJavaValue() {
        List<Object> result = new ArrayList<Object>(items.size());
        for (RibValue item : items) {
            result.add(item.toJavaValue());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RibList && ((RibList) o).items.equals(items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
