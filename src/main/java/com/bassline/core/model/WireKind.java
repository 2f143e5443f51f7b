package com.bassline.core.model;

public enum WireKind {
    /** Delivers in both directions, each guarded by value-equality suppression. */
    BIDIRECTIONAL,
    /** Delivers from {@code fromId} to {@code toId} only. */
    DIRECTED;

    public static WireKind fromString(String text) {
        if (text == null)
            return BIDIRECTIONAL;
        for (WireKind k : values()) {
            if (k.name().equalsIgnoreCase(text.trim())) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown WireKind: " + text);
    }
}
