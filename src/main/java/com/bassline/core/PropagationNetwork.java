package com.bassline.core;

import com.bassline.core.api.ChangeListener;
import com.bassline.core.api.ChangeType;
import com.bassline.core.api.NetworkChange;
import com.bassline.core.api.PropagationListener;
import com.bassline.core.api.Subscription;
import com.bassline.core.engine.GadgetBinding;
import com.bassline.core.engine.GroupArena;
import com.bassline.core.engine.PropagationResult;
import com.bassline.core.engine.PropagationScheduler;
import com.bassline.core.engine.SchedulerConfig;
import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;
import com.bassline.core.io.NetworkSnapshot;
import com.bassline.core.lattice.Contradiction;
import com.bassline.core.lattice.LatticeValue;
import com.bassline.core.model.BlendMode;
import com.bassline.core.model.BoundaryDirection;
import com.bassline.core.model.Contact;
import com.bassline.core.model.ContactRecord;
import com.bassline.core.model.ContactSpec;
import com.bassline.core.model.Group;
import com.bassline.core.model.GroupRecord;
import com.bassline.core.model.GroupSpec;
import com.bassline.core.model.GroupState;
import com.bassline.core.model.Wire;
import com.bassline.core.model.WireKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The public entry point of a propagation network.
 *
 * Owns the group arena, the scheduler and the change subscriptions. All
 * structural edits and writes go through this object; reads return immutable
 * records.
 *
 * <pre>
 * PropagationNetwork net = new PropagationNetwork();
 * String a = net.addContact(net.rootGroupId(), ContactSpec.merge("a"));
 * String b = net.addContact(net.rootGroupId(), ContactSpec.merge("b"));
 * net.connect(a, b, WireKind.BIDIRECTIONAL);
 * net.updateContact(a, Values.growSet("x"));
 * net.getContact(b).content(); // GrowSet{"x"}
 * </pre>
 *
 * Structural edits such as {@link #connect} only queue work; it is flushed by
 * the next {@link #updateContact} or {@link #propagate()}.
 *
 * Thread Safety: none. Confine a network to one thread, or feed it through
 * {@link com.bassline.core.wiring.NetworkPublisher}.
 */
public final class PropagationNetwork {
    private static final Logger log = LogManager.getLogger(PropagationNetwork.class);

    public static final String DEFAULT_ROOT_ID = "root";

    private final GadgetRegistry registry;
    private final SchedulerConfig config;
    private final Map<String, List<ChangeListener>> subscribers = new HashMap<>();

    private GroupArena arena;
    private PropagationScheduler scheduler;
    private PropagationListener listener;
    private String rootGroupId;

    public PropagationNetwork() {
        this(DEFAULT_ROOT_ID, new GadgetRegistry(), SchedulerConfig.defaults());
    }

    public PropagationNetwork(GadgetRegistry registry, SchedulerConfig config) {
        this(DEFAULT_ROOT_ID, registry, config);
    }

    public PropagationNetwork(String rootGroupId, GadgetRegistry registry, SchedulerConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = config != null ? config : SchedulerConfig.defaults();
        this.arena = new GroupArena();
        this.scheduler = new PropagationScheduler(arena, this.config);
        this.rootGroupId = arena.addGroup(GroupSpec.root(rootGroupId, rootGroupId)).id();
    }

    /**
     * Builds a network from a snapshot.
     *
     * @throws IllegalArgumentException if the snapshot is inconsistent or names
     *                                  an unknown gadget.
     */
    public static PropagationNetwork fromSnapshot(NetworkSnapshot snapshot, GadgetRegistry registry,
            SchedulerConfig config) {
        PropagationNetwork net = new PropagationNetwork(snapshot.rootGroupId(), registry, config);
        net.importSnapshot(snapshot);
        return net;
    }

    public String rootGroupId() {
        return rootGroupId;
    }

    public GadgetRegistry registry() {
        return registry;
    }

    public SchedulerConfig config() {
        return config;
    }

    public long epoch() {
        return scheduler.epoch();
    }

    public void setListener(PropagationListener listener) {
        this.listener = listener;
        scheduler.setListener(listener);
    }

    // ── Groups ───────────────────────────────────────────────────────

    /**
     * Registers a group. A spec without a parent is placed under the root. A
     * spec with a {@code primitiveId} instantiates that gadget: one boundary
     * contact per port, with id {@code groupId.port}.
     *
     * @return The group id.
     * @throws IllegalArgumentException for duplicate ids, unknown parents or
     *                                  unknown gadget ids.
     */
    public String registerGroup(GroupSpec spec) {
        GadgetSpec gadget = spec.primitiveId() != null ? registry.lookup(spec.primitiveId()) : null;
        String id = spec.id() != null ? spec.id() : arena.nextId("group");
        spec = new GroupSpec(id, spec.name(), spec.parentId() != null ? spec.parentId() : rootGroupId,
                spec.primitiveId());
        if (gadget != null) {
            // Port ids are checked before the group exists so a clash leaves no half-built gadget.
            for (String port : gadget.inputs())
                requireFreeContactId(GadgetBinding.portContactId(id, port));
            for (String port : gadget.outputs())
                requireFreeContactId(GadgetBinding.portContactId(id, port));
        }
        Group g = arena.addGroup(spec);
        if (gadget != null)
            instantiate(arena, g, gadget);
        if (g.parentId() != null)
            emit(g.parentId(), NetworkChange.of(ChangeType.GROUP_ADDED, g.parentId(), g.id()));
        return g.id();
    }

    private void requireFreeContactId(String contactId) {
        if (arena.findContact(contactId) != null)
            throw new IllegalArgumentException("Duplicate contact id: " + contactId);
    }

    /** Adds a plain child group. */
    public String addGroup(String parentId, String name) {
        return registerGroup(GroupSpec.child(null, name, parentId));
    }

    /**
     * Instantiates a registered gadget as a new primitive subgroup.
     *
     * @return The new group id; its ports are contacts {@code groupId.port}.
     */
    public String createPrimitiveGadget(String parentGroupId, String gadgetId) {
        return registerGroup(GroupSpec.primitive(null, parentGroupId, gadgetId));
    }

    private static void instantiate(GroupArena target, Group group, GadgetSpec gadget) {
        Map<String, String> inputs = new LinkedHashMap<>();
        Map<String, String> outputs = new LinkedHashMap<>();
        for (String port : gadget.inputs())
            inputs.put(port, addPort(target, group, port, BoundaryDirection.INPUT));
        for (String port : gadget.outputs())
            outputs.put(port, addPort(target, group, port, BoundaryDirection.OUTPUT));
        target.bindGadget(new GadgetBinding(group.id(), gadget, inputs, outputs));
    }

    private static String addPort(GroupArena target, Group group, String port, BoundaryDirection direction) {
        String id = GadgetBinding.portContactId(group.id(), port);
        target.addContact(group.id(), new ContactSpec(id, port, BlendMode.ACCEPT_LAST, null, true, direction));
        return id;
    }

    /**
     * Removes a group, its descendants, their contacts and every wire touching
     * them.
     */
    public void removeGroup(String groupId) {
        if (groupId.equals(rootGroupId))
            throw new IllegalArgumentException("Cannot remove the root group " + groupId);
        Group g = arena.group(groupId);
        List<String> doomed = arena.subtree(groupId);
        for (String gid : doomed) {
            scheduler.forgetGroup(gid);
            for (String cid : arena.group(gid).contactIds())
                scheduler.forgetContact(cid);
        }
        List<Wire> removedWires = arena.removeGroup(groupId);
        for (Wire w : removedWires) {
            if (arena.hasGroup(w.groupId()))
                emit(w.groupId(), NetworkChange.of(ChangeType.WIRE_REMOVED, w.groupId(), w.id()));
        }
        for (String gid : doomed) {
            emit(gid, NetworkChange.of(ChangeType.GROUP_REMOVED, gid, gid));
            subscribers.remove(gid);
        }
        if (g.parentId() != null)
            emit(g.parentId(), NetworkChange.of(ChangeType.GROUP_REMOVED, g.parentId(), groupId));
    }

    /**
     * Publishes a contact on a group's boundary: either the group's own
     * boundary contact or a re-export of a boundary contact of one direct
     * subgroup.
     */
    public void exposeBoundary(String groupId, String contactId) {
        arena.exposeBoundary(groupId, contactId);
        emit(groupId, NetworkChange.of(ChangeType.GROUP_UPDATED, groupId, groupId));
    }

    // ── Contacts ─────────────────────────────────────────────────────

    /**
     * @return The new contact id.
     * @throws IllegalArgumentException if the group is unknown or primitive, or
     *                                  the id is taken.
     */
    public String addContact(String groupId, ContactSpec spec) {
        Group g = arena.group(groupId);
        if (g.isPrimitive())
            throw new IllegalArgumentException("Cannot add contacts to primitive group " + groupId);
        Contact c = arena.addContact(groupId, spec);
        if (c.isSet())
            scheduler.markDirty(c.id());
        log.debug("Added contact {} to {}", c.id(), groupId);
        emit(groupId, NetworkChange.of(ChangeType.CONTACT_ADDED, groupId, c.id()));
        return c.id();
    }

    /**
     * Writes a value to a contact and propagates to the fixpoint.
     *
     * @throws Contradiction           if the write contradicts the stored value;
     *                                 nothing is written or propagated.
     * @throws IllegalArgumentException if the contact is unknown.
     */
    public PropagationResult updateContact(String contactId, LatticeValue value) {
        stageUpdate(contactId, value);
        return propagate();
    }

    /**
     * Writes a value without propagating. Several staged writes are flushed
     * together by the next {@link #propagate()}.
     *
     * @return {@code true} if the stored value changed.
     */
    public boolean stageUpdate(String contactId, LatticeValue value) {
        try {
            return scheduler.write(contactId, value);
        } catch (Contradiction c) {
            log.warn("Rejected write to {}: {}", contactId, c.getMessage());
            throw c;
        }
    }

    /**
     * Runs queued work to the fixpoint and notifies subscribers of the groups
     * whose contacts changed.
     */
    public PropagationResult propagate() {
        PropagationResult result = scheduler.propagate();
        if (!result.changedContactIds().isEmpty() && !subscribers.isEmpty())
            publishUpdates(result);
        return result;
    }

    private void publishUpdates(PropagationResult result) {
        Map<String, List<NetworkChange>> byGroup = new LinkedHashMap<>();
        for (String cid : result.changedContactIds()) {
            Contact c = arena.findContact(cid);
            if (c == null)
                continue;
            for (String gid : groupsSeeing(c)) {
                if (subscribers.containsKey(gid))
                    byGroup.computeIfAbsent(gid, k -> new ArrayList<>())
                            .add(new NetworkChange(ChangeType.CONTACT_UPDATED, gid, cid, c.content()));
            }
        }
        byGroup.forEach(this::deliver);
    }

    // The owning group plus every ancestor the contact is exposed to.
    private List<String> groupsSeeing(Contact c) {
        List<String> out = new ArrayList<>(2);
        out.add(c.groupId());
        for (String gid = arena.group(c.groupId()).parentId(); gid != null; gid = arena.group(gid).parentId()) {
            if (!arena.isVisibleIn(c.id(), gid))
                break;
            out.add(gid);
        }
        return out;
    }

    /**
     * Removes a contact and every wire touching it.
     */
    public void removeContact(String contactId) {
        Contact c = arena.contact(contactId);
        if (arena.group(c.groupId()).isPrimitive())
            throw new IllegalArgumentException("Cannot remove gadget port " + contactId);
        scheduler.forgetContact(contactId);
        for (Wire w : arena.removeContact(contactId))
            emit(w.groupId(), NetworkChange.of(ChangeType.WIRE_REMOVED, w.groupId(), w.id()));
        emit(c.groupId(), NetworkChange.of(ChangeType.CONTACT_REMOVED, c.groupId(), contactId));
    }

    public ContactRecord getContact(String contactId) {
        Contact c = arena.findContact(contactId);
        return c != null ? c.toRecord() : null;
    }

    // ── Wires ────────────────────────────────────────────────────────

    /**
     * Connects two contacts. The wire is owned by the deepest group in which
     * both are visible. The source (and, for bidirectional wires, the target) is
     * queued so that existing values flow on the next pass.
     *
     * @return The wire id.
     * @throws IllegalArgumentException for unknown ids, self-wires or contacts
     *                                  not visible in a common group.
     */
    public String connect(String fromId, String toId, WireKind kind) {
        return connect(null, fromId, toId, kind);
    }

    /**
     * As {@link #connect(String, String, WireKind)}, with an explicit wire id.
     */
    public String connect(String wireId, String fromId, String toId, WireKind kind) {
        Wire w = arena.addWire(wireId, fromId, toId, kind);
        scheduler.markDirty(fromId);
        if (w.kind() == WireKind.BIDIRECTIONAL)
            scheduler.markDirty(toId);
        log.debug("Connected {} -> {} ({}) in {}", fromId, toId, w.kind(), w.groupId());
        emit(w.groupId(), NetworkChange.of(ChangeType.WIRE_ADDED, w.groupId(), w.id()));
        return w.id();
    }

    public String connect(String fromId, String toId) {
        return connect(fromId, toId, WireKind.BIDIRECTIONAL);
    }

    /** Disconnects a wire. Values already delivered stay where they are. */
    public void removeWire(String wireId) {
        Wire w = arena.removeWire(wireId);
        emit(w.groupId(), NetworkChange.of(ChangeType.WIRE_REMOVED, w.groupId(), wireId));
    }

    public Wire getWire(String wireId) {
        return arena.findWire(wireId);
    }

    /** Wires with the contact at either end, in creation order. */
    public List<Wire> wiresTouching(String contactId) {
        arena.contact(contactId);
        return arena.wiresTouching(contactId);
    }

    // ── State ────────────────────────────────────────────────────────

    /**
     * @throws IllegalArgumentException if the group is unknown.
     */
    public GroupState getState(String groupId) {
        return stateOf(arena.group(groupId));
    }

    private GroupState stateOf(Group g) {
        Map<String, ContactRecord> contacts = new LinkedHashMap<>();
        for (String cid : g.contactIds())
            contacts.put(cid, arena.contact(cid).toRecord());
        Map<String, Wire> wires = new LinkedHashMap<>();
        for (String wid : g.wireIds())
            wires.put(wid, arena.wire(wid));
        return new GroupState(g.toRecord(), contacts, wires);
    }

    /** Snapshot of the whole network. */
    public NetworkSnapshot flatten() {
        return flatten(rootGroupId);
    }

    /** Snapshot of a group and all its descendants. */
    public NetworkSnapshot flatten(String groupId) {
        Map<String, GroupState> groups = new LinkedHashMap<>();
        for (String gid : arena.subtree(groupId))
            groups.put(gid, stateOf(arena.group(gid)));
        return new NetworkSnapshot(groupId, groups);
    }

    /**
     * Replaces the whole network with the snapshot's contents. The snapshot
     * root becomes the root group. Nothing changes if the import fails.
     *
     * Contacts take their recorded values as-is; no propagation is run.
     *
     * @throws IllegalArgumentException if a primitive id is not registered, a
     *                                  gadget port is missing, or the snapshot
     *                                  is structurally inconsistent.
     */
    public void importSnapshot(NetworkSnapshot snapshot) {
        if (scheduler.isRunning())
            throw new IllegalStateException("Cannot import while propagating");
        GroupArena next = new GroupArena();
        String root = snapshot.rootGroupId();
        List<String[]> reexports = new ArrayList<>();

        for (GroupState state : snapshot.groups().values()) {
            GroupRecord rec = state.group();
            String parentId = rec.id().equals(root) ? null : rec.parentId();
            if (parentId != null && !next.hasGroup(parentId))
                throw new IllegalArgumentException("Group " + rec.id() + " precedes its parent " + parentId);
            GadgetSpec gadget = rec.primitiveId() != null ? registry.lookup(rec.primitiveId()) : null;
            Group g = next.addGroup(new GroupSpec(rec.id(), rec.name(), parentId, rec.primitiveId()));
            for (ContactRecord c : state.contacts().values()) {
                next.addContact(g.id(), new ContactSpec(c.id(), c.name(), c.blendMode(), c.content(), c.boundary(),
                        c.boundaryDirection()));
            }
            if (gadget != null)
                bindImported(next, g, gadget);
            for (String cid : rec.boundaryContactIds()) {
                if (!state.contacts().containsKey(cid))
                    reexports.add(new String[] { rec.id(), cid });
            }
        }
        // Deepest re-exports first, since parents may re-export what children re-export.
        for (int i = reexports.size() - 1; i >= 0; i--)
            next.exposeBoundary(reexports.get(i)[0], reexports.get(i)[1]);

        for (GroupState state : snapshot.groups().values()) {
            for (Wire w : state.wires().values()) {
                Wire added = next.addWire(w.id(), w.fromId(), w.toId(), w.kind());
                if (!added.groupId().equals(state.group().id()))
                    throw new IllegalArgumentException("Wire " + w.id() + " belongs in " + added.groupId()
                            + ", not " + state.group().id());
            }
        }

        this.arena = next;
        this.scheduler = new PropagationScheduler(next, config);
        this.scheduler.setListener(listener);
        this.rootGroupId = root;
        subscribers.keySet().removeIf(gid -> !next.hasGroup(gid));
        log.info("Imported snapshot rooted at {}: {} groups, {} contacts, {} wires", root,
                snapshot.groups().size(), next.contacts().size(), next.wires().size());
        for (String gid : List.copyOf(subscribers.keySet()))
            emit(gid, NetworkChange.of(ChangeType.GROUP_UPDATED, gid, gid));
    }

    private static void bindImported(GroupArena target, Group g, GadgetSpec gadget) {
        Map<String, String> inputs = new LinkedHashMap<>();
        Map<String, String> outputs = new LinkedHashMap<>();
        for (String port : gadget.inputs())
            inputs.put(port, requirePort(target, g, port));
        for (String port : gadget.outputs())
            outputs.put(port, requirePort(target, g, port));
        target.bindGadget(new GadgetBinding(g.id(), gadget, inputs, outputs));
    }

    private static String requirePort(GroupArena target, Group g, String port) {
        String id = GadgetBinding.portContactId(g.id(), port);
        if (!g.contactIds().contains(id))
            throw new IllegalArgumentException(
                    "Primitive group " + g.id() + " (" + g.primitiveId() + ") is missing port contact " + id);
        return id;
    }

    // ── Subscriptions ────────────────────────────────────────────────

    /**
     * Subscribes to the changes of one group. Listener exceptions are logged
     * and do not affect the network.
     */
    public Subscription subscribe(String groupId, ChangeListener changeListener) {
        arena.group(groupId);
        Objects.requireNonNull(changeListener, "changeListener");
        subscribers.computeIfAbsent(groupId, k -> new CopyOnWriteArrayList<>()).add(changeListener);
        return () -> {
            List<ChangeListener> list = subscribers.get(groupId);
            if (list != null) {
                list.remove(changeListener);
                if (list.isEmpty())
                    subscribers.remove(groupId);
            }
        };
    }

    private void emit(String groupId, NetworkChange change) {
        if (subscribers.containsKey(groupId))
            deliver(groupId, List.of(change));
    }

    private void deliver(String groupId, List<NetworkChange> changes) {
        List<ChangeListener> list = subscribers.get(groupId);
        if (list == null)
            return;
        for (ChangeListener l : list) {
            try {
                l.onChanges(changes);
            } catch (RuntimeException e) {
                log.error("Change listener on {} failed", groupId, e);
            }
        }
    }
}
