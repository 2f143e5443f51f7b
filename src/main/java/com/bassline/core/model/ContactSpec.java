package com.bassline.core.model;

import com.bassline.core.lattice.LatticeValue;

/**
 * Request to create a contact.
 *
 * @param id                Explicit id, or {@code null} to have one generated.
 * @param content           Initial value, or {@code null} to start unset.
 * @param boundaryDirection Only meaningful when {@code boundary} is set.
 */
public record ContactSpec(String id, String name, BlendMode blendMode, LatticeValue content, boolean boundary,
        BoundaryDirection boundaryDirection) {

    public static ContactSpec merge(String name) {
        return new ContactSpec(null, name, BlendMode.MERGE, null, false, null);
    }

    public static ContactSpec acceptLast(String name) {
        return new ContactSpec(null, name, BlendMode.ACCEPT_LAST, null, false, null);
    }

    public static ContactSpec input(String name, BlendMode blendMode) {
        return new ContactSpec(null, name, blendMode, null, true, BoundaryDirection.INPUT);
    }

    public static ContactSpec output(String name, BlendMode blendMode) {
        return new ContactSpec(null, name, blendMode, null, true, BoundaryDirection.OUTPUT);
    }

    public ContactSpec withId(String newId) {
        return new ContactSpec(newId, name, blendMode, content, boundary, boundaryDirection);
    }

    public ContactSpec withContent(LatticeValue value) {
        return new ContactSpec(id, name, blendMode, value, boundary, boundaryDirection);
    }
}
