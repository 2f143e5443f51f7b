package com.bassline.core.engine;

import com.bassline.core.gadget.GadgetSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A gadget instantiated in a primitive group: the resolved spec plus the
 * contacts standing for each of its ports.
 *
 * @param inputPorts  Port name to contact id.
 * @param outputPorts Port name to contact id.
 */
public record GadgetBinding(String groupId, GadgetSpec spec, Map<String, String> inputPorts,
        Map<String, String> outputPorts) {

    public GadgetBinding {
        inputPorts = Collections.unmodifiableMap(new LinkedHashMap<>(inputPorts));
        outputPorts = Collections.unmodifiableMap(new LinkedHashMap<>(outputPorts));
    }

    public boolean isInput(String contactId) {
        return inputPorts.containsValue(contactId);
    }

    /** Contact id used for a port of a primitive group. */
    public static String portContactId(String groupId, String port) {
        return groupId + "." + port;
    }
}
