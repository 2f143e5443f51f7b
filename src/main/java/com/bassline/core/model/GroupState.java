package com.bassline.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a group owns, as returned by {@code getState(groupId)} and stored
 * per group in a snapshot.
 */
public record GroupState(GroupRecord group, Map<String, ContactRecord> contacts, Map<String, Wire> wires) {

    public GroupState {
        contacts = contacts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(contacts));
        wires = wires == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(wires));
    }

    public ContactRecord contact(String contactId) {
        return contacts.get(contactId);
    }
}
