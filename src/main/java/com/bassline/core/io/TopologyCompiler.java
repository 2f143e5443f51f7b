package com.bassline.core.io;

import com.bassline.core.PropagationNetwork;
import com.bassline.core.engine.PropagationResult;
import com.bassline.core.engine.SchedulerConfig;
import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.model.BlendMode;
import com.bassline.core.model.BoundaryDirection;
import com.bassline.core.model.ContactSpec;
import com.bassline.core.model.GroupSpec;
import com.bassline.core.model.Wire;
import com.bassline.core.model.WireKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a {@link TopologyDefinition} into a live {@link PropagationNetwork}.
 *
 * Compilation runs in three passes so that definitions may refer forward:
 * groups and their contacts, then boundary re-exports (innermost groups
 * first), then wires. Initial contact values are propagated once at the end.
 */
@Log4j2
public final class TopologyCompiler {
    private final GadgetRegistry registry;

    public TopologyCompiler() {
        this(new GadgetRegistry());
    }

    public TopologyCompiler(GadgetRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws IllegalArgumentException for unknown gadgets, duplicate ids, or
     *                                  wires whose endpoints are not visible in
     *                                  the group that declares them.
     */
    public PropagationNetwork compile(TopologyDefinition def) {
        String root = def.getRoot() != null ? def.getRoot() : PropagationNetwork.DEFAULT_ROOT_ID;
        PropagationNetwork net = new PropagationNetwork(root, registry,
                SchedulerConfig.fromProperties(def.getSettings()));

        List<Placed> placed = new ArrayList<>();
        for (TopologyDefinition.GroupDef g : nullSafe(def.getGroups()))
            declare(net, g, root, placed);

        for (int i = placed.size() - 1; i >= 0; i--) {
            Placed p = placed.get(i);
            for (String contactId : nullSafe(p.def.getBoundary()))
                net.exposeBoundary(p.groupId, contactId);
        }

        for (Placed p : placed) {
            for (TopologyDefinition.WireDef w : nullSafe(p.def.getWires()))
                wire(net, p.groupId, w);
        }

        PropagationResult result = net.propagate();
        if (!result.isClean())
            log.warn("Topology '{}' settled with {} contradictions and {} gadget faults", def.getName(),
                    result.contradictions().size(), result.faults().size());
        log.info("Compiled topology '{}': {} groups, settled in {} steps", def.getName(), placed.size(),
                result.steps());
        return net;
    }

    private void declare(PropagationNetwork net, TopologyDefinition.GroupDef def, String parentId,
            List<Placed> placed) {
        String groupId;
        if (def.getId() != null && def.getId().equals(net.rootGroupId())) {
            groupId = net.rootGroupId();
        } else {
            groupId = net.registerGroup(
                    new GroupSpec(def.getId(), def.getName(), parentId, def.getPrimitive()));
        }
        placed.add(new Placed(groupId, def));

        if (def.getPrimitive() != null) {
            if (!nullSafe(def.getContacts()).isEmpty() || !nullSafe(def.getSubgroups()).isEmpty())
                throw new IllegalArgumentException(
                        "Primitive group " + groupId + " cannot declare contacts or subgroups");
            return;
        }

        for (TopologyDefinition.ContactDef c : nullSafe(def.getContacts())) {
            if (c.getId() == null && c.getName() == null)
                throw new IllegalArgumentException("Contact in group " + groupId + " needs an id or a name");
            String id = c.getId() != null ? c.getId() : groupId + "." + c.getName();
            BoundaryDirection direction = c.isBoundary()
                    ? BoundaryDirection.fromString(c.getDirection())
                    : null;
            net.addContact(groupId, new ContactSpec(id, c.getName(), BlendMode.fromString(c.getBlendMode()),
                    c.getContent(), c.isBoundary(), direction));
        }

        for (TopologyDefinition.GroupDef sub : nullSafe(def.getSubgroups()))
            declare(net, sub, groupId, placed);
    }

    private static void wire(PropagationNetwork net, String groupId, TopologyDefinition.WireDef w) {
        if (w.getFrom() == null || w.getTo() == null)
            throw new IllegalArgumentException("Wire in group " + groupId + " needs 'from' and 'to'");
        String wireId = net.connect(w.getId(), w.getFrom(), w.getTo(), WireKind.fromString(w.getKind()));
        Wire created = net.getWire(wireId);
        if (!created.groupId().equals(groupId)) {
            net.removeWire(wireId);
            throw new IllegalArgumentException("Wire " + w.getFrom() + " -> " + w.getTo() + " is declared in "
                    + groupId + " but its endpoints meet in " + created.groupId());
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }

    private record Placed(String groupId, TopologyDefinition.GroupDef def) {
    }
}
