package com.bassline.core.engine;

/**
 * One failed gadget invocation.
 */
public record GadgetFault(String groupId, String gadgetId, Throwable error) {
}
