package com.bassline.core.lattice;

import java.util.Map;

/**
 * Deflationary map. Merge keeps only keys present on both sides.
 */
public record ShrinkMap(Map<String, LatticeValue> entries) implements TaggedCollection, KeyedCollection {

    public ShrinkMap {
        entries = Elements.canonicalMap(entries);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.SHRINK_MAP;
    }

    @Override
    public boolean isGrowing() {
        return false;
    }

    @Override
    public String toString() {
        return "ShrinkMap{" + Elements.joinEntries(entries) + "}";
    }
}
