package rib.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AsPath 值（AS_SEQUENCE，首元素为最近的邻居，末元素为起源 AS）
 */
public final class RibAsPath extends RibValue {

    public static final RibAsPath EMPTY = new RibAsPath(Collections.<RibAsn>emptyList());

    public static RibAsPath of(List<RibAsn> hops) {
        return hops.isEmpty() ? EMPTY : new RibAsPath(Collections.unmodifiableList(new ArrayList<RibAsn>(hops)));
    }

    public static RibAsPath of(long... asns) {
        List<RibAsn> hops = new ArrayList<RibAsn>(asns.length);
        for (long asn : asns) {
            hops.add(RibAsn.of(asn));
        }
        return of(hops);
    }

    private final List<RibAsn> hops;

    private RibAsPath(List<RibAsn> hops) {
        this.hops = hops;
    }

    public List<RibAsn> getHops() {
        return hops;
    }

    public int length() {
        return hops.size();
    }

    /** 起源 AS；空路径返回 AS0 */
    public RibAsn origin() {
        return hops.isEmpty() ? RibAsn.ZERO : hops.get(hops.size() - 1);
    }

    /** 最近的邻居 AS；空路径返回 AS0 */
    public RibAsn first() {
        return hops.isEmpty() ? RibAsn.ZERO : hops.get(0);
    }

    public boolean contains(RibAsn asn) {
        return hops.contains(asn);
    }

    @Override
    public String getTypeName() {
        return "AsPath";
    }

    @Override
    public Object toJavaValue() {
        List<Long> result = new ArrayList<Long>(hops.size());
        for (RibAsn hop : hops) {
            result.add(hop.getValue());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RibAsPath && ((RibAsPath) o).hops.equals(hops);
    }

    @Override
    public int hashCode() {
        return hops.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (RibAsn hop : hops) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(hop.getValue());
        }
        return sb.toString();
    }
}
