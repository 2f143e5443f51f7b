package com.bassline.core.gadget.primitives;

import com.bassline.core.gadget.Activation;
import com.bassline.core.gadget.GadgetBody;
import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;

import java.util.List;

/**
 * Impure gadgets. These run on every activation and are never memoized.
 */
public final class SystemGadgets {
    static final String CATEGORY = "system";

    private SystemGadgets() {
    }

    public static void register(GadgetRegistry registry) {
        registry.register(new GadgetSpec("timestamp", List.of("trigger"), List.of("time"),
                Activation.allOf(List.of("trigger")),
                GadgetBody.sync(in -> Ports.out("time", (double) System.currentTimeMillis())), false, CATEGORY,
                "Wall-clock millis each time trigger changes"));
    }
}
