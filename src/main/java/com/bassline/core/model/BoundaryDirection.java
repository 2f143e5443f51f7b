package com.bassline.core.model;

public enum BoundaryDirection {
    INPUT,
    OUTPUT;

    public static BoundaryDirection fromString(String text) {
        if (text == null)
            return null;
        for (BoundaryDirection d : values()) {
            if (d.name().equalsIgnoreCase(text.trim())) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown BoundaryDirection: " + text);
    }
}
