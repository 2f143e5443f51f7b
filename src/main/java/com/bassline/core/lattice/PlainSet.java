package com.bassline.core.lattice;

import java.util.List;
import java.util.Set;

/**
 * Legacy untagged set. Merges as a union.
 */
public record PlainSet(Set<LatticeValue> values) implements ElementCollection {

    public PlainSet {
        values = Elements.canonicalSet(values);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.SET;
    }

    @Override
    public List<LatticeValue> elements() {
        return List.copyOf(values);
    }

    @Override
    public String toString() {
        return "Set{" + Elements.join(values) + "}";
    }
}
