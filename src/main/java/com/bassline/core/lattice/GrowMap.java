package com.bassline.core.lattice;

import java.util.Map;

/**
 * Inflationary map. Merge keeps every key; values under a shared key are
 * merged recursively.
 */
public record GrowMap(Map<String, LatticeValue> entries) implements TaggedCollection, KeyedCollection {

    public GrowMap {
        entries = Elements.canonicalMap(entries);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.GROW_MAP;
    }

    @Override
    public boolean isGrowing() {
        return true;
    }

    @Override
    public String toString() {
        return "GrowMap{" + Elements.joinEntries(entries) + "}";
    }
}
