package com.bassline.core.lattice;

/**
 * The "none" scalar. Acts as the identity element of merge.
 */
public enum NoneValue implements LatticeValue {
    INSTANCE;

    @Override
    public ValueKind kind() {
        return ValueKind.NONE;
    }

    @Override
    public String toString() {
        return "none";
    }
}
