package com.bassline.core.lattice;

import java.util.List;
import java.util.Set;

/**
 * Inflationary set: merge is union.
 */
public record GrowSet(Set<LatticeValue> values) implements TaggedCollection, ElementCollection {

    public GrowSet {
        values = Elements.canonicalSet(values);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.GROW_SET;
    }

    @Override
    public boolean isGrowing() {
        return true;
    }

    @Override
    public List<LatticeValue> elements() {
        return List.copyOf(values);
    }

    public boolean contains(LatticeValue value) {
        return values.contains(value);
    }

    @Override
    public String toString() {
        return "GrowSet{" + Elements.join(values) + "}";
    }
}
