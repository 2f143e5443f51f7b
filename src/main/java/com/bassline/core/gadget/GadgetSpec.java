package com.bassline.core.gadget;

import com.bassline.core.lattice.LatticeValue;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A registered gadget: ports, activation predicate and body, resolved once when
 * a group is instantiated from it.
 *
 * @param pure Pure gadgets have no effect beyond their outputs and may be
 *             skipped when re-activated with identical inputs. Impure gadgets
 *             (I/O, clocks, randomness) run once per activation and are never
 *             cached.
 */
public record GadgetSpec(String id, List<String> inputs, List<String> outputs, Activation activation,
        GadgetBody body, boolean pure, String category, String description) {

    public GadgetSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(activation, "activation");
        Objects.requireNonNull(body, "body");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        if (inputs.stream().anyMatch(outputs::contains))
            throw new IllegalArgumentException("Gadget " + id + " reuses a port name for input and output");
    }

    /**
     * A pure gadget that fires once all inputs are present.
     */
    public static GadgetSpec strict(String id, String category, String description, List<String> inputs,
            List<String> outputs, Function<Map<String, LatticeValue>, Map<String, LatticeValue>> fn) {
        return new GadgetSpec(id, inputs, outputs, Activation.allOf(inputs), GadgetBody.sync(fn), true, category,
                description);
    }

    /**
     * A pure gadget that fires as soon as any input is present.
     */
    public static GadgetSpec partial(String id, String category, String description, List<String> inputs,
            List<String> outputs, Function<Map<String, LatticeValue>, Map<String, LatticeValue>> fn) {
        return new GadgetSpec(id, inputs, outputs, Activation.anyOf(inputs), GadgetBody.sync(fn), true, category,
                description);
    }
}
