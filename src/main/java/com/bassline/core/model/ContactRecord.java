package com.bassline.core.model;

import com.bassline.core.lattice.LatticeValue;

/**
 * Immutable view of a contact, used by {@link GroupState} and snapshots.
 *
 * @param content {@code null} when the contact is unset.
 */
public record ContactRecord(String id, String groupId, String name, LatticeValue content, BlendMode blendMode,
        boolean boundary, BoundaryDirection boundaryDirection) {
}
