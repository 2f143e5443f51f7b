package com.bassline.core.lattice;

/**
 * Discriminator for every {@link LatticeValue} variant.
 *
 * The declaration order doubles as the cross-kind rank used by
 * {@link ValueOrdering}: values of an earlier kind sort before values of a
 * later one.
 */
public enum ValueKind {
    NONE("None"),
    BOOL("Bool"),
    NUMBER("Number"),
    STRING("String"),
    DICT("Dict"),
    ARRAY("Array"),
    SET("Set"),
    GROW_SET("GrowSet"),
    SHRINK_SET("ShrinkSet"),
    GROW_ARRAY("GrowArray"),
    SHRINK_ARRAY("ShrinkArray"),
    GROW_MAP("GrowMap"),
    SHRINK_MAP("ShrinkMap");

    private final String tag;

    ValueKind(String tag) {
        this.tag = tag;
    }

    /** The wire tag written into JSON ({@code "_tag"}). */
    public String tag() {
        return tag;
    }

    public boolean isScalar() {
        return this == NONE || this == BOOL || this == NUMBER || this == STRING;
    }

    public boolean isTagged() {
        return ordinal() >= GROW_SET.ordinal();
    }

    public static ValueKind fromTag(String tag) {
        for (ValueKind k : values()) {
            if (k.tag.equalsIgnoreCase(tag) || k.name().equalsIgnoreCase(tag)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown value tag: " + tag);
    }
}
