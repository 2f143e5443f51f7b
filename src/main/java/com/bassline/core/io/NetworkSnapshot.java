package com.bassline.core.io;

import com.bassline.core.model.GroupState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A group subtree captured by {@code flatten}: every group's record, contacts
 * and wires, keyed by group id with parents before children.
 *
 * Gadget bodies are not captured; primitive groups carry only their
 * {@code primitiveId}, which is resolved against a registry on import.
 */
public record NetworkSnapshot(String rootGroupId, Map<String, GroupState> groups) {

    public NetworkSnapshot {
        Objects.requireNonNull(rootGroupId, "rootGroupId");
        groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
        if (!groups.containsKey(rootGroupId))
            throw new IllegalArgumentException("Snapshot does not contain its root group " + rootGroupId);
    }

    public GroupState group(String groupId) {
        return groups.get(groupId);
    }

    public int contactCount() {
        int n = 0;
        for (GroupState g : groups.values())
            n += g.contacts().size();
        return n;
    }
}
