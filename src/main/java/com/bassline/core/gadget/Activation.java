package com.bassline.core.gadget;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a gadget is ready to fire, given the names of the input
 * ports that currently hold a value.
 */
@FunctionalInterface
public interface Activation {

    boolean isReady(Set<String> presentInputs);

    /** Strict: every listed port must be present. */
    static Activation allOf(List<String> ports) {
        List<String> required = List.copyOf(ports);
        return present -> present.containsAll(required);
    }

    /** Partial: at least one of the listed ports must be present. */
    static Activation anyOf(List<String> ports) {
        List<String> candidates = List.copyOf(ports);
        return present -> {
            for (String p : candidates)
                if (present.contains(p))
                    return true;
            return false;
        };
    }
}
