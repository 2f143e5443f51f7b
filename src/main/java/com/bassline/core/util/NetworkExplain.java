package com.bassline.core.util;

import com.bassline.core.PropagationNetwork;
import com.bassline.core.model.ContactRecord;
import com.bassline.core.model.GroupRecord;
import com.bassline.core.model.GroupState;
import com.bassline.core.model.Wire;
import com.bassline.core.model.WireKind;

import java.util.List;

/**
 * Diagnostic utility for inspecting network state and topology.
 *
 * <p>
 * <b>Usage:</b> debugging sessions and error logs. Do <b>not</b> use on a hot
 * path (allocates strings, walks the group).
 */
public final class NetworkExplain {
    private final PropagationNetwork network;

    public NetworkExplain(PropagationNetwork network) {
        this.network = network;
    }

    /**
     * Dumps the state of a single contact and the wires touching it.
     */
    public String explainContact(String contactId) {
        ContactRecord c = network.getContact(contactId);
        if (c == null)
            throw new IllegalArgumentException("Unknown contact: " + contactId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Contact: ").append(c.id()).append('\n')
                .append("  Name: ").append(c.name()).append('\n')
                .append("  Group: ").append(c.groupId()).append('\n')
                .append("  Blend mode: ").append(c.blendMode()).append('\n')
                .append("  Boundary: ").append(c.boundary()
                        ? "yes" + (c.boundaryDirection() != null ? " (" + c.boundaryDirection() + ")" : "")
                        : "no")
                .append('\n')
                .append("  Value: ").append(c.content() != null ? c.content() : "<unset>").append('\n');
        List<Wire> wires = network.wiresTouching(contactId);
        sb.append("  Wires (").append(wires.size()).append("):");
        for (Wire w : wires) {
            sb.append("\n    ").append(w.id()).append(": ").append(w.fromId())
                    .append(w.kind() == WireKind.DIRECTED ? " -> " : " <-> ").append(w.toId());
        }
        return sb.append('\n').toString();
    }

    /**
     * Summarizes a group: its contacts with values, wires and subgroups.
     */
    public String dumpGroup(String groupId) {
        GroupState state = network.getState(groupId);
        GroupRecord g = state.group();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Group ").append(g.id());
        if (g.primitiveId() != null)
            sb.append(" (primitive ").append(g.primitiveId()).append(')');
        sb.append(": ").append(state.contacts().size()).append(" contacts, ")
                .append(state.wires().size()).append(" wires, ")
                .append(g.subgroupIds().size()).append(" subgroups\n");
        for (ContactRecord c : state.contacts().values()) {
            sb.append("  ").append(c.id());
            if (g.boundaryContactIds().contains(c.id()))
                sb.append(" [boundary]");
            sb.append(" = ").append(c.content() != null ? c.content() : "<unset>").append('\n');
        }
        for (Wire w : state.wires().values())
            sb.append("  ").append(w.fromId()).append(w.kind() == WireKind.DIRECTED ? " -> " : " <-> ")
                    .append(w.toId()).append('\n');
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart of one group: its own contacts, the boundary
     * contacts of its direct subgroups (drawn inside a subgraph each) and its
     * wires. Directed wires render as {@code -->}, bidirectional ones as
     * {@code <-->}.
     */
    public String toMermaid(String groupId) {
        GroupState state = network.getState(groupId);
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");

        for (ContactRecord c : state.contacts().values())
            appendContact(sb, "  ", c);

        for (String subId : state.group().subgroupIds()) {
            GroupRecord sub = network.getState(subId).group();
            String title = sub.primitiveId() != null ? sub.name() + " (" + sub.primitiveId() + ")" : sub.name();
            sb.append("  subgraph ").append(sanitize(sub.id())).append("[\"").append(escape(title))
                    .append("\"]\n");
            for (String cid : sub.boundaryContactIds())
                appendContact(sb, "    ", network.getContact(cid));
            sb.append("  end\n");
        }

        for (Wire w : state.wires().values()) {
            sb.append("  ").append(sanitize(w.fromId()))
                    .append(w.kind() == WireKind.DIRECTED ? " --> " : " <--> ")
                    .append(sanitize(w.toId())).append(";\n");
        }
        return sb.toString();
    }

    private static void appendContact(StringBuilder sb, String indent, ContactRecord c) {
        String label = (c.name() != null ? c.name() : c.id()) + " = "
                + (c.content() != null ? c.content().toString() : "∅");
        sb.append(indent).append(sanitize(c.id()));
        if (c.boundary())
            sb.append("([\"").append(escape(label)).append("\"]);\n");
        else
            sb.append("[\"").append(escape(label)).append("\"];\n");
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
