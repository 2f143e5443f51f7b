package com.bassline.core.lattice;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Copy helpers that put collection members into canonical form.
 */
final class Elements {
    private Elements() {
        // Utility class
    }

    static Set<LatticeValue> canonicalSet(Collection<? extends LatticeValue> values) {
        List<LatticeValue> sorted = canonicalList(values);
        return Collections.unmodifiableSet(new LinkedHashSet<>(sorted));
    }

    static List<LatticeValue> canonicalList(Collection<? extends LatticeValue> values) {
        List<LatticeValue> sorted = new ArrayList<>(values.size());
        for (LatticeValue v : values)
            sorted.add(Objects.requireNonNull(v, "collection members must not be null"));
        sorted.sort(ValueOrdering.INSTANCE);
        return Collections.unmodifiableList(sorted);
    }

    static List<LatticeValue> orderedList(Collection<? extends LatticeValue> values) {
        List<LatticeValue> copy = new ArrayList<>(values.size());
        for (LatticeValue v : values)
            copy.add(Objects.requireNonNull(v, "collection members must not be null"));
        return Collections.unmodifiableList(copy);
    }

    static Map<String, LatticeValue> canonicalMap(Map<String, ? extends LatticeValue> entries) {
        return orderedMap(new TreeMap<>(entries));
    }

    static Map<String, LatticeValue> orderedMap(Map<String, ? extends LatticeValue> entries) {
        Map<String, LatticeValue> copy = new LinkedHashMap<>(entries.size() * 2);
        for (Map.Entry<String, ? extends LatticeValue> e : entries.entrySet()) {
            copy.put(Objects.requireNonNull(e.getKey(), "map keys must not be null"),
                    Objects.requireNonNull(e.getValue(), "map values must not be null"));
        }
        return Collections.unmodifiableMap(copy);
    }

    /** Element multiplicities, in first-seen order. */
    static Map<LatticeValue, Integer> counts(Collection<? extends LatticeValue> values) {
        Map<LatticeValue, Integer> counts = new LinkedHashMap<>();
        for (LatticeValue v : values)
            counts.merge(v, 1, Integer::sum);
        return counts;
    }

    static String join(Collection<?> values) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        for (Object v : values) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(v);
        }
        return sb.toString();
    }

    static String joinEntries(Map<String, ? extends LatticeValue> entries) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        for (Map.Entry<String, ? extends LatticeValue> e : entries.entrySet()) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.toString();
    }
}
