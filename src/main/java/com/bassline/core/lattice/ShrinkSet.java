package com.bassline.core.lattice;

import java.util.List;
import java.util.Set;

public record ShrinkSet(Set<LatticeValue> values) implements TaggedCollection, ElementCollection {

    public ShrinkSet {
        values = Elements.canonicalSet(values);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.SHRINK_SET;
    }

    @Override
    public boolean isGrowing() {
        return false;
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
        return "ShrinkSet{" + Elements.join(values) + "}";
    }
}
