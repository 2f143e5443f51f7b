package com.bassline.core.lattice;

import java.util.List;

/**
 * Inflationary array with multiset semantics.
 *
 * Duplicates are significant. Merge keeps every element with the larger of its
 * two multiplicities, and items are held in canonical order, so the join does
 * not depend on which side arrived first.
 */
public record GrowArray(List<LatticeValue> items) implements TaggedCollection, ElementCollection {

    public GrowArray {
        items = Elements.canonicalList(items);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.GROW_ARRAY;
    }

    @Override
    public boolean isGrowing() {
        return true;
    }

    @Override
    public List<LatticeValue> elements() {
        return items;
    }

    @Override
    public String toString() {
        return "GrowArray[" + Elements.join(items) + "]";
    }
}
