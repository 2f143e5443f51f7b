package com.bassline.core.lattice;

public record BoolValue(boolean value) implements LatticeValue {
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.BOOL;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
