package com.bassline.core.lattice;

import java.util.Objects;

public record StringValue(String value) implements LatticeValue {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.STRING;
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
