package com.bassline.core.model;

import com.bassline.core.lattice.Contradiction;
import com.bassline.core.lattice.LatticeMerge;
import com.bassline.core.lattice.LatticeValue;

import java.util.Objects;

/**
 * A cell of the network: holds one lattice value (or nothing) and a blend
 * policy.
 *
 * State machine: unset, then set on the first successful write. A write under
 * {@link BlendMode#ACCEPT_LAST} replaces the value; under {@link BlendMode#MERGE}
 * it joins with it. A contradicting merge leaves the contact untouched and
 * rethrows, so a contact never holds a "contradiction" state.
 *
 * Contacts are mutated only by the propagation engine and the network facade;
 * read access from outside goes through {@link ContactRecord} copies.
 */
public final class Contact {
    private final String id;
    private final String groupId;
    private final String name;
    private final BlendMode blendMode;
    private final boolean boundary;
    private final BoundaryDirection boundaryDirection;
    private LatticeValue content;

    public Contact(String id, String groupId, String name, BlendMode blendMode, boolean boundary,
            BoundaryDirection boundaryDirection) {
        this.id = Objects.requireNonNull(id, "id");
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.name = name;
        this.blendMode = blendMode == null ? BlendMode.ACCEPT_LAST : blendMode;
        this.boundary = boundary;
        this.boundaryDirection = boundaryDirection;
    }

    public String id() {
        return id;
    }

    public String groupId() {
        return groupId;
    }

    public String name() {
        return name;
    }

    public BlendMode blendMode() {
        return blendMode;
    }

    public boolean isBoundary() {
        return boundary;
    }

    public BoundaryDirection boundaryDirection() {
        return boundaryDirection;
    }

    /** Current value, or {@code null} while unset. */
    public LatticeValue content() {
        return content;
    }

    public boolean isSet() {
        return content != null;
    }

    /**
     * Applies a write according to the blend mode.
     *
     * @param incoming The value delivered to this contact.
     * @return {@code true} if the stored value changed.
     * @throws Contradiction if merging fails; the old value is kept.
     */
    public boolean write(LatticeValue incoming) {
        if (incoming == null)
            return false;
        LatticeValue next = blendMode == BlendMode.MERGE
                ? LatticeMerge.merge(content, incoming)
                : incoming;
        if (Objects.equals(next, content))
            return false;
        content = next;
        return true;
    }

    /**
     * Puts a value back without blending. Used for initial seeding, snapshot
     * import and rolling back an aborted propagation pass.
     */
    public void reset(LatticeValue value) {
        this.content = value;
    }

    public ContactRecord toRecord() {
        return new ContactRecord(id, groupId, name, content, blendMode, boundary, boundaryDirection);
    }

    @Override
    public String toString() {
        return "Contact[" + id + (name != null ? " '" + name + "'" : "") + " = " + content + ", " + blendMode + "]";
    }
}
