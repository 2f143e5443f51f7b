package com.bassline.core.gadget.primitives;

import static com.bassline.core.gadget.primitives.Ports.out;
import static com.bassline.core.gadget.primitives.Ports.string;

import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;
import com.bassline.core.lattice.LatticeValue;

import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

public final class StringGadgets {
    static final String CATEGORY = "string";

    private StringGadgets() {
    }

    public static void register(GadgetRegistry registry) {
        // Missing sides concatenate as empty.
        registry.register(GadgetSpec.partial("concat", CATEGORY, "Concatenates a and b", List.of("a", "b"),
                List.of("result"), in -> {
                    LatticeValue a = in.get("a");
                    LatticeValue b = in.get("b");
                    return out("result", (a == null ? "" : Ports.text(a)) + (b == null ? "" : Ports.text(b)));
                }));
        registry.register(unary("uppercase", "Upper-cases a string", s -> s.toUpperCase(Locale.ROOT)));
        registry.register(unary("lowercase", "Lower-cases a string", s -> s.toLowerCase(Locale.ROOT)));
        registry.register(unary("trim", "Strips surrounding whitespace", String::strip));
        registry.register(GadgetSpec.strict("length", CATEGORY, "Number of characters", List.of("value"),
                List.of("result"), in -> out("result", string(in, "value").length())));
    }

    private static GadgetSpec unary(String id, String description, UnaryOperator<String> op) {
        return GadgetSpec.strict(id, CATEGORY, description, List.of("value"), List.of("result"),
                in -> out("result", op.apply(string(in, "value"))));
    }
}
