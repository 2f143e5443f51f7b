package com.bassline.core.api;

import com.bassline.core.lattice.LatticeValue;

/**
 * A structural or value change inside one group.
 *
 * @param groupId   The group the change is reported to.
 * @param subjectId The contact, wire or group that changed.
 * @param value     New content for {@link ChangeType#CONTACT_UPDATED}, otherwise
 *                  {@code null}.
 */
public record NetworkChange(ChangeType type, String groupId, String subjectId, LatticeValue value) {

    public static NetworkChange of(ChangeType type, String groupId, String subjectId) {
        return new NetworkChange(type, groupId, subjectId, null);
    }
}
