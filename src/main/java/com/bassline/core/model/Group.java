package com.bassline.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A namespace and unit of ownership for contacts and wires.
 *
 * Groups refer to each other only by id. The id-indexed arena that holds them
 * is {@link com.bassline.core.engine.GroupArena}; the mutators here are called
 * by the arena and should not be used directly.
 */
public final class Group {
    private final String id;
    private final String name;
    private final String primitiveId;
    private String parentId;

    private final Set<String> contactIds = new LinkedHashSet<>();
    private final Set<String> wireIds = new LinkedHashSet<>();
    private final Set<String> subgroupIds = new LinkedHashSet<>();
    private final Set<String> boundaryContactIds = new LinkedHashSet<>();

    public Group(String id, String name, String parentId, String primitiveId) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.parentId = parentId;
        this.primitiveId = primitiveId;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String parentId() {
        return parentId;
    }

    public String primitiveId() {
        return primitiveId;
    }

    public boolean isPrimitive() {
        return primitiveId != null;
    }

    public Set<String> contactIds() {
        return Collections.unmodifiableSet(contactIds);
    }

    public Set<String> wireIds() {
        return Collections.unmodifiableSet(wireIds);
    }

    public Set<String> subgroupIds() {
        return Collections.unmodifiableSet(subgroupIds);
    }

    public Set<String> boundaryContactIds() {
        return Collections.unmodifiableSet(boundaryContactIds);
    }

    // ── Arena-managed mutation ───────────────────────────────────────

    public void reparent(String newParentId) {
        this.parentId = newParentId;
    }

    public void addContactId(String contactId) {
        contactIds.add(contactId);
    }

    public void removeContactId(String contactId) {
        contactIds.remove(contactId);
        boundaryContactIds.remove(contactId);
    }

    public void addWireId(String wireId) {
        wireIds.add(wireId);
    }

    public void removeWireId(String wireId) {
        wireIds.remove(wireId);
    }

    public void addSubgroupId(String groupId) {
        subgroupIds.add(groupId);
    }

    public void removeSubgroupId(String groupId) {
        subgroupIds.remove(groupId);
    }

    public void addBoundaryContactId(String contactId) {
        boundaryContactIds.add(contactId);
    }

    public void removeBoundaryContactId(String contactId) {
        boundaryContactIds.remove(contactId);
    }

    public GroupRecord toRecord() {
        return new GroupRecord(id, name, parentId, primitiveId, List.copyOf(contactIds), List.copyOf(wireIds),
                List.copyOf(subgroupIds), List.copyOf(boundaryContactIds));
    }

    @Override
    public String toString() {
        return "Group[" + id + (primitiveId != null ? " primitive=" + primitiveId : "") + ", contacts="
                + contactIds.size() + ", wires=" + wireIds.size() + ", subgroups=" + subgroupIds.size() + "]";
    }
}
