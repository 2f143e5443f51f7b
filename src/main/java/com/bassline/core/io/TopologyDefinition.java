package com.bassline.core.io;

import com.bassline.core.lattice.LatticeValue;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a network topology.
 *
 * <pre>
 * {
 *   "root": "root",
 *   "settings": {"maxSteps": 500},
 *   "groups": [
 *     {"id": "calc",
 *      "contacts": [{"name": "x", "blendMode": "merge", "boundary": true, "direction": "input"}],
 *      "subgroups": [{"id": "adder", "primitive": "add"}],
 *      "wires": [{"from": "calc.x", "to": "adder.a", "kind": "directed"}],
 *      "boundary": ["adder.sum"]}
 *   ]
 * }
 * </pre>
 *
 * Top-level groups are children of the root; a group whose id is the root id
 * fills the root itself. A contact without an id gets {@code groupId.name}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class TopologyDefinition {
    private String name;
    private String root;
    private Map<String, Object> settings;
    private List<GroupDef> groups;

    /** Definition of a group, or of a gadget instance when primitive is set. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GroupDef {
        private String id, name, primitive;
        private List<ContactDef> contacts;
        private List<WireDef> wires;
        private List<GroupDef> subgroups;
        /** Subgroup boundary contacts to re-export on this group's boundary. */
        private List<String> boundary;
    }

    /** Definition of a single contact. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ContactDef {
        private String id, name, blendMode, direction;
        private boolean boundary;
        private LatticeValue content;
    }

    /** Definition of a wire between two contact ids. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class WireDef {
        private String id, from, to, kind;
    }
}
