package com.bassline.core.lattice;

/**
 * A numeric scalar. All numbers are held as doubles so that {@code 1} and
 * {@code 1.0} are the same value.
 */
public record NumberValue(double value) implements LatticeValue {

    public NumberValue {
        // -0.0 and 0.0 are one value.
        if (value == 0.0)
            value = 0.0;
    }

    public static NumberValue of(double value) {
        return new NumberValue(value);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.NUMBER;
    }

    public boolean isIntegral() {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    @Override
    public String toString() {
        return isIntegral() && Math.abs(value) < 1e15 ? Long.toString((long) value) : Double.toString(value);
    }
}
