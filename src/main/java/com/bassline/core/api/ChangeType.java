package com.bassline.core.api;

public enum ChangeType {
    CONTACT_ADDED,
    CONTACT_UPDATED,
    CONTACT_REMOVED,
    WIRE_ADDED,
    WIRE_REMOVED,
    GROUP_ADDED,
    GROUP_UPDATED,
    GROUP_REMOVED
}
