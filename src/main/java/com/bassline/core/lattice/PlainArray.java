package com.bassline.core.lattice;

import java.util.List;

/**
 * Legacy untagged array. Order is significant and merge concatenates.
 */
public record PlainArray(List<LatticeValue> items) implements ElementCollection {

    public PlainArray {
        items = Elements.orderedList(items);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.ARRAY;
    }

    @Override
    public List<LatticeValue> elements() {
        return items;
    }

    @Override
    public String toString() {
        return "[" + Elements.join(items) + "]";
    }
}
