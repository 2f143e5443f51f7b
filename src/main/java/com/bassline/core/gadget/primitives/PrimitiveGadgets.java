package com.bassline.core.gadget.primitives;

import com.bassline.core.gadget.GadgetRegistry;

/**
 * Entry point for the built-in gadget library.
 */
public final class PrimitiveGadgets {

    private PrimitiveGadgets() {
    }

    public static void registerAll(GadgetRegistry registry) {
        MathGadgets.register(registry);
        LogicGadgets.register(registry);
        StringGadgets.register(registry);
        ComparisonGadgets.register(registry);
        CollectionGadgets.register(registry);
        SystemGadgets.register(registry);
    }
}
