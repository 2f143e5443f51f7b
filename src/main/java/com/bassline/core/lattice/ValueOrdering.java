package com.bassline.core.lattice;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Total order over lattice values, used to store set members and tagged array
 * items canonically.
 *
 * Values of different kinds compare by {@link ValueKind} rank. Within a kind:
 * booleans false before true, numbers numerically ({@link Double#compare}),
 * strings lexicographically, collections element by element and then by size,
 * keyed collections entry by entry in key order.
 */
public final class ValueOrdering implements Comparator<LatticeValue> {
    public static final ValueOrdering INSTANCE = new ValueOrdering();

    private ValueOrdering() {
    }

    @Override
    public int compare(LatticeValue a, LatticeValue b) {
        if (a == b)
            return 0;
        int byKind = Integer.compare(a.kind().ordinal(), b.kind().ordinal());
        if (byKind != 0)
            return byKind;

        if (a instanceof BoolValue x && b instanceof BoolValue y)
            return Boolean.compare(x.value(), y.value());
        if (a instanceof NumberValue x && b instanceof NumberValue y)
            return Double.compare(x.value(), y.value());
        if (a instanceof StringValue x && b instanceof StringValue y)
            return x.value().compareTo(y.value());
        if (a instanceof ElementCollection x && b instanceof ElementCollection y)
            return compareLists(x.elements(), y.elements());
        if (a instanceof KeyedCollection x && b instanceof KeyedCollection y)
            return compareMaps(x.entries(), y.entries());
        return 0; // NONE
    }

    private int compareLists(List<LatticeValue> a, List<LatticeValue> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compare(a.get(i), b.get(i));
            if (c != 0)
                return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private int compareMaps(Map<String, LatticeValue> a, Map<String, LatticeValue> b) {
        Iterator<Map.Entry<String, LatticeValue>> ia = new TreeMap<>(a).entrySet().iterator();
        Iterator<Map.Entry<String, LatticeValue>> ib = new TreeMap<>(b).entrySet().iterator();
        while (ia.hasNext() && ib.hasNext()) {
            Map.Entry<String, LatticeValue> ea = ia.next();
            Map.Entry<String, LatticeValue> eb = ib.next();
            int c = ea.getKey().compareTo(eb.getKey());
            if (c != 0)
                return c;
            c = compare(ea.getValue(), eb.getValue());
            if (c != 0)
                return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
