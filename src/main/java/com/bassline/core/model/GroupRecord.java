package com.bassline.core.model;

import java.util.List;

/**
 * Immutable copy of a {@link Group}. Child groups appear by id only.
 */
public record GroupRecord(String id, String name, String parentId, String primitiveId, List<String> contactIds,
        List<String> wireIds, List<String> subgroupIds, List<String> boundaryContactIds) {

    public GroupRecord {
        contactIds = contactIds == null ? List.of() : List.copyOf(contactIds);
        wireIds = wireIds == null ? List.of() : List.copyOf(wireIds);
        subgroupIds = subgroupIds == null ? List.of() : List.copyOf(subgroupIds);
        boundaryContactIds = boundaryContactIds == null ? List.of() : List.copyOf(boundaryContactIds);
    }
}
