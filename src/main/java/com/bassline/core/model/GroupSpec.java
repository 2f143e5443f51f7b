package com.bassline.core.model;

/**
 * Request to register a group.
 *
 * @param id          Explicit id, or {@code null} to have one generated.
 * @param parentId    Parent group, or {@code null} for a root.
 * @param primitiveId Gadget registry id when the group is an opaque gadget
 *                    instance, otherwise {@code null}.
 */
public record GroupSpec(String id, String name, String parentId, String primitiveId) {

    public static GroupSpec root(String id, String name) {
        return new GroupSpec(id, name, null, null);
    }

    public static GroupSpec child(String id, String name, String parentId) {
        return new GroupSpec(id, name, parentId, null);
    }

    public static GroupSpec primitive(String id, String parentId, String primitiveId) {
        return new GroupSpec(id, primitiveId, parentId, primitiveId);
    }
}
