package com.bassline.core.gadget.primitives;

import static com.bassline.core.gadget.primitives.Ports.bool;
import static com.bassline.core.gadget.primitives.Ports.out;

import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;
import com.bassline.core.lattice.BoolValue;
import com.bassline.core.lattice.LatticeValue;

import java.util.List;
import java.util.Map;

/**
 * Boolean gadgets, plus {@code gate} which forwards a value while enabled.
 */
public final class LogicGadgets {
    static final String CATEGORY = "logic";

    private LogicGadgets() {
    }

    public static void register(GadgetRegistry registry) {
        registry.register(GadgetSpec.strict("and", CATEGORY, "Logical AND", List.of("a", "b"), List.of("result"),
                in -> out("result", bool(in, "a") && bool(in, "b"))));
        registry.register(GadgetSpec.strict("or", CATEGORY, "Logical OR", List.of("a", "b"), List.of("result"),
                in -> out("result", bool(in, "a") || bool(in, "b"))));
        registry.register(GadgetSpec.strict("xor", CATEGORY, "Logical XOR", List.of("a", "b"), List.of("result"),
                in -> out("result", bool(in, "a") ^ bool(in, "b"))));
        registry.register(GadgetSpec.strict("not", CATEGORY, "Logical NOT", List.of("value"), List.of("result"),
                in -> out("result", !bool(in, "value"))));

        // Fires on value alone; emits only once enabled is known to be true.
        registry.register(GadgetSpec.partial("gate", CATEGORY, "Passes value through while enabled is true",
                List.of("value", "enabled"), List.of("result"), in -> {
                    LatticeValue value = in.get("value");
                    if (value == null || !BoolValue.TRUE.equals(in.get("enabled")))
                        return Map.of();
                    return Map.of("result", value);
                }));
    }
}
