package com.bassline.core.gadget.primitives;

import static com.bassline.core.gadget.primitives.Ports.elements;
import static com.bassline.core.gadget.primitives.Ports.out;

import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;
import com.bassline.core.lattice.ElementCollection;
import com.bassline.core.lattice.GrowSet;
import com.bassline.core.lattice.LatticeValue;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gadgets over sets and arrays. Results are always {@link GrowSet}s so that
 * they accumulate safely downstream.
 */
public final class CollectionGadgets {
    static final String CATEGORY = "collection";

    private CollectionGadgets() {
    }

    public static void register(GadgetRegistry registry) {
        registry.register(GadgetSpec.partial("union", CATEGORY, "Union of a and b as a grow-set",
                List.of("a", "b"), List.of("result"), in -> {
                    Set<LatticeValue> all = new LinkedHashSet<>();
                    if (in.containsKey("a"))
                        all.addAll(elements(in, "a").elements());
                    if (in.containsKey("b"))
                        all.addAll(elements(in, "b").elements());
                    return Map.of("result", new GrowSet(all));
                }));
        registry.register(GadgetSpec.strict("size", CATEGORY, "Number of elements", List.of("value"),
                List.of("result"), in -> out("result", elements(in, "value").size())));
        registry.register(GadgetSpec.strict("to-grow-set", CATEGORY, "Lifts any set or array into a grow-set",
                List.of("value"), List.of("result"), in -> {
                    ElementCollection c = elements(in, "value");
                    return Map.of("result", new GrowSet(new LinkedHashSet<>(c.elements())));
                }));
    }
}
