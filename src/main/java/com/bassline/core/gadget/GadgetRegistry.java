package com.bassline.core.gadget;

import com.bassline.core.gadget.primitives.PrimitiveGadgets;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Table of gadget implementations keyed by id.
 *
 * The network looks gadgets up here once, when a primitive group is created or
 * imported; after that the resolved {@link GadgetSpec} is used directly.
 */
@Log4j2
public final class GadgetRegistry {
    private final Map<String, GadgetSpec> registry = new LinkedHashMap<>();

    /** A registry pre-loaded with the built-in primitives. */
    public GadgetRegistry() {
        this(true);
    }

    private GadgetRegistry(boolean withBuiltIns) {
        if (withBuiltIns)
            PrimitiveGadgets.registerAll(this);
    }

    /** A registry with no gadgets at all. */
    public static GadgetRegistry empty() {
        return new GadgetRegistry(false);
    }

    /**
     * Registers or replaces a gadget.
     *
     * @return this registry, for chaining.
     */
    public GadgetRegistry register(GadgetSpec spec) {
        GadgetSpec previous = registry.put(spec.id(), spec);
        if (previous != null)
            log.debug("Replaced gadget '{}'", spec.id());
        return this;
    }

    public boolean contains(String id) {
        return registry.containsKey(id);
    }

    /**
     * @throws IllegalArgumentException if no gadget is registered under the id.
     */
    public GadgetSpec lookup(String id) {
        GadgetSpec spec = registry.get(id);
        if (spec == null)
            throw new IllegalArgumentException("Unknown gadget: " + id);
        return spec;
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    public int size() {
        return registry.size();
    }
}
