package com.bassline.core.model;

import java.util.Objects;

/**
 * A link between two contacts, owned by the group it was created in.
 */
public record Wire(String id, String groupId, String fromId, String toId, WireKind kind) {

    public Wire {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean touches(String contactId) {
        return fromId.equals(contactId) || toId.equals(contactId);
    }

    /**
     * Returns the contact this wire delivers to when {@code sourceId} changes,
     * or {@code null} if the wire does not carry values away from it.
     */
    public String targetFor(String sourceId) {
        if (fromId.equals(sourceId))
            return toId;
        if (kind == WireKind.BIDIRECTIONAL && toId.equals(sourceId))
            return fromId;
        return null;
    }
}
