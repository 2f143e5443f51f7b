package com.bassline.core.gadget.primitives;

import com.bassline.core.lattice.BoolValue;
import com.bassline.core.lattice.ElementCollection;
import com.bassline.core.lattice.LatticeValue;
import com.bassline.core.lattice.NumberValue;
import com.bassline.core.lattice.StringValue;

import java.util.Map;

/**
 * Typed access to gadget input maps.
 */
final class Ports {

    private Ports() {
    }

    static double number(Map<String, LatticeValue> inputs, String port) {
        LatticeValue v = inputs.get(port);
        if (v instanceof NumberValue n)
            return n.value();
        throw new IllegalArgumentException("Port '" + port + "' expects a number, got " + v);
    }

    static boolean bool(Map<String, LatticeValue> inputs, String port) {
        LatticeValue v = inputs.get(port);
        if (v instanceof BoolValue b)
            return b.value();
        throw new IllegalArgumentException("Port '" + port + "' expects a boolean, got " + v);
    }

    static String string(Map<String, LatticeValue> inputs, String port) {
        LatticeValue v = inputs.get(port);
        if (v instanceof StringValue s)
            return s.value();
        throw new IllegalArgumentException("Port '" + port + "' expects a string, got " + v);
    }

    static ElementCollection elements(Map<String, LatticeValue> inputs, String port) {
        LatticeValue v = inputs.get(port);
        if (v instanceof ElementCollection c)
            return c;
        throw new IllegalArgumentException("Port '" + port + "' expects a set or array, got " + v);
    }

    /** Renders any scalar as text, for string concatenation. */
    static String text(LatticeValue v) {
        if (v instanceof StringValue s)
            return s.value();
        return String.valueOf(v);
    }

    static Map<String, LatticeValue> out(String port, double value) {
        return Map.of(port, NumberValue.of(value));
    }

    static Map<String, LatticeValue> out(String port, boolean value) {
        return Map.of(port, BoolValue.of(value));
    }

    static Map<String, LatticeValue> out(String port, String value) {
        return Map.of(port, StringValue.of(value));
    }
}
