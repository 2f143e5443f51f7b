package com.bassline.core.lattice;

import java.util.Map;

/**
 * Plain, untagged map. Keeps insertion order; equality ignores it.
 */
public record DictValue(Map<String, LatticeValue> entries) implements KeyedCollection {

    public static final DictValue EMPTY = new DictValue(Map.of());

    public DictValue {
        entries = Elements.orderedMap(entries);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.DICT;
    }

    @Override
    public String toString() {
        return "{" + Elements.joinEntries(entries) + "}";
    }
}
