package com.bassline.core.gadget.primitives;

import static com.bassline.core.gadget.primitives.Ports.number;
import static com.bassline.core.gadget.primitives.Ports.out;

import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;

import java.util.List;

public final class ComparisonGadgets {
    static final String CATEGORY = "comparison";

    private ComparisonGadgets() {
    }

    public static void register(GadgetRegistry registry) {
        // eq works on any values; lt/gt are numeric.
        registry.register(GadgetSpec.strict("eq", CATEGORY, "Structural equality of a and b", List.of("a", "b"),
                List.of("result"), in -> out("result", in.get("a").equals(in.get("b")))));
        registry.register(GadgetSpec.strict("lt", CATEGORY, "a < b", List.of("a", "b"), List.of("result"),
                in -> out("result", number(in, "a") < number(in, "b"))));
        registry.register(GadgetSpec.strict("gt", CATEGORY, "a > b", List.of("a", "b"), List.of("result"),
                in -> out("result", number(in, "a") > number(in, "b"))));
    }
}
