package com.bassline.core.model;

/**
 * How a contact combines an incoming value with the one it holds.
 */
public enum BlendMode {
    /** Last writer wins. Order sensitive; meant for interactive widgets. */
    ACCEPT_LAST,
    /** Lattice join through {@link com.bassline.core.lattice.LatticeMerge}. */
    MERGE;

    public static BlendMode fromString(String text) {
        if (text == null)
            return ACCEPT_LAST;
        String normalized = text.trim().replace('-', '_');
        for (BlendMode m : values()) {
            if (m.name().equalsIgnoreCase(normalized)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown BlendMode: " + text);
    }
}
