package com.bassline.core.lattice;

import java.util.List;

/**
 * Deflationary array with multiset semantics: merge keeps each element with
 * the smaller of its two multiplicities.
 */
public record ShrinkArray(List<LatticeValue> items) implements TaggedCollection, ElementCollection {

    public ShrinkArray {
        items = Elements.canonicalList(items);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.SHRINK_ARRAY;
    }

    @Override
    public boolean isGrowing() {
        return false;
    }

    @Override
    public List<LatticeValue> elements() {
        return items;
    }

    @Override
    public String toString() {
        return "ShrinkArray[" + Elements.join(items) + "]";
    }
}
