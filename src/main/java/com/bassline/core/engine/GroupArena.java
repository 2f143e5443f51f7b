package com.bassline.core.engine;

import com.bassline.core.model.Contact;
import com.bassline.core.model.ContactSpec;
import com.bassline.core.model.Group;
import com.bassline.core.model.GroupSpec;
import com.bassline.core.model.Wire;
import com.bassline.core.model.WireKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Id-indexed storage for the group tree and everything it owns.
 *
 * Groups, contacts and wires live in flat maps and refer to each other by id
 * only. The arena keeps the ownership lists on each {@link Group} in step with
 * the maps, plus a wires-by-contact index used by the scheduler to find the
 * fan-out of a dirty contact.
 *
 * Visibility: a contact is visible in group G if G owns it, or if it is a
 * boundary contact of one of G's direct subgroups. Both endpoints of a wire
 * must be visible in the wire's group.
 *
 * Not thread-safe; owned by a single network.
 */
public final class GroupArena {
    private static final Logger log = LogManager.getLogger(GroupArena.class);

    private final Map<String, Group> groups = new LinkedHashMap<>();
    private final Map<String, Contact> contacts = new LinkedHashMap<>();
    private final Map<String, Wire> wires = new LinkedHashMap<>();
    private final Map<String, Set<String>> wiresByContact = new HashMap<>();
    private final Map<String, GadgetBinding> gadgets = new HashMap<>();

    private long idSequence;

    /** Generates an id not used by any group, contact or wire. */
    public String nextId(String prefix) {
        String id;
        do {
            id = prefix + "-" + (++idSequence);
        } while (groups.containsKey(id) || contacts.containsKey(id) || wires.containsKey(id));
        return id;
    }

    // ── Groups ───────────────────────────────────────────────────────

    public Group addGroup(GroupSpec spec) {
        String id = spec.id() != null ? spec.id() : nextId("group");
        if (groups.containsKey(id))
            throw new IllegalArgumentException("Duplicate group id: " + id);
        Group parent = null;
        if (spec.parentId() != null) {
            parent = group(spec.parentId());
            if (parent.isPrimitive())
                throw new IllegalArgumentException("Primitive group " + parent.id() + " cannot hold subgroups");
        }
        Group g = new Group(id, spec.name() != null ? spec.name() : id, spec.parentId(), spec.primitiveId());
        groups.put(id, g);
        if (parent != null)
            parent.addSubgroupId(id);
        log.debug("Added group {} (parent={}, primitive={})", id, spec.parentId(), spec.primitiveId());
        return g;
    }

    /**
     * @throws IllegalArgumentException if the group does not exist.
     */
    public Group group(String id) {
        Group g = groups.get(id);
        if (g == null)
            throw new IllegalArgumentException("Unknown group: " + id);
        return g;
    }

    public Group findGroup(String id) {
        return groups.get(id);
    }

    public boolean hasGroup(String id) {
        return groups.containsKey(id);
    }

    public Collection<Group> groups() {
        return Collections.unmodifiableCollection(groups.values());
    }

    /** The group and all its descendants, parents before children. */
    public List<String> subtree(String groupId) {
        List<String> out = new ArrayList<>();
        collectSubtree(group(groupId), out);
        return out;
    }

    private void collectSubtree(Group g, List<String> out) {
        out.add(g.id());
        for (String child : g.subgroupIds())
            collectSubtree(group(child), out);
    }

    /**
     * Removes a group with all its descendants, their contacts and every wire
     * touching one of those contacts (including wires owned by the parent).
     *
     * @return The removed wires.
     */
    public List<Wire> removeGroup(String groupId) {
        Group root = group(groupId);
        List<String> doomed = subtree(groupId);
        List<Wire> removedWires = new ArrayList<>();

        for (String gid : doomed) {
            Group g = group(gid);
            for (String cid : List.copyOf(g.contactIds())) {
                for (Wire w : wiresTouching(cid))
                    removedWires.add(removeWire(w.id()));
            }
            for (String wid : List.copyOf(g.wireIds())) {
                if (wires.containsKey(wid))
                    removedWires.add(removeWire(wid));
            }
        }

        // Children first so that re-exports are unwound bottom-up.
        for (int i = doomed.size() - 1; i >= 0; i--) {
            Group g = groups.remove(doomed.get(i));
            for (String cid : g.contactIds()) {
                contacts.remove(cid);
                wiresByContact.remove(cid);
            }
            gadgets.remove(g.id());
        }

        Group parent = root.parentId() != null ? groups.get(root.parentId()) : null;
        if (parent != null)
            parent.removeSubgroupId(groupId);
        // Re-exports may reach any ancestor, not just the parent.
        for (Group a = parent; a != null; a = a.parentId() != null ? groups.get(a.parentId()) : null) {
            for (String cid : List.copyOf(a.boundaryContactIds())) {
                if (!contacts.containsKey(cid))
                    a.removeBoundaryContactId(cid);
            }
        }
        log.debug("Removed group {} ({} groups, {} wires)", groupId, doomed.size(), removedWires.size());
        return removedWires;
    }

    /**
     * Adds a boundary contact to a group's boundary list. The contact must be
     * either a boundary contact owned by the group or a boundary contact of
     * exactly one direct subgroup (re-export).
     */
    public void exposeBoundary(String groupId, String contactId) {
        Group g = group(groupId);
        Contact c = contact(contactId);
        if (c.groupId().equals(groupId)) {
            if (!c.isBoundary())
                throw new IllegalArgumentException("Contact " + contactId + " is not a boundary contact");
        } else {
            int owners = 0;
            for (String sub : g.subgroupIds()) {
                if (group(sub).boundaryContactIds().contains(contactId))
                    owners++;
            }
            if (owners != 1)
                throw new IllegalArgumentException(
                        "Contact " + contactId + " is not a boundary of exactly one subgroup of " + groupId);
        }
        g.addBoundaryContactId(contactId);
    }

    // ── Contacts ─────────────────────────────────────────────────────

    public Contact addContact(String groupId, ContactSpec spec) {
        Group g = group(groupId);
        String id = spec.id() != null ? spec.id() : nextId("contact");
        if (contacts.containsKey(id))
            throw new IllegalArgumentException("Duplicate contact id: " + id);
        Contact c = new Contact(id, groupId, spec.name(), spec.blendMode(), spec.boundary(),
                spec.boundary() ? spec.boundaryDirection() : null);
        c.reset(spec.content());
        contacts.put(id, c);
        g.addContactId(id);
        if (c.isBoundary())
            g.addBoundaryContactId(id);
        return c;
    }

    /**
     * @throws IllegalArgumentException if the contact does not exist.
     */
    public Contact contact(String id) {
        Contact c = contacts.get(id);
        if (c == null)
            throw new IllegalArgumentException("Unknown contact: " + id);
        return c;
    }

    public Contact findContact(String id) {
        return contacts.get(id);
    }

    public Collection<Contact> contacts() {
        return Collections.unmodifiableCollection(contacts.values());
    }

    /**
     * Removes a contact and every wire touching it. Re-exports of the contact by
     * ancestor groups are withdrawn.
     *
     * @return The removed wires.
     */
    public List<Wire> removeContact(String contactId) {
        Contact c = contact(contactId);
        List<Wire> removed = new ArrayList<>();
        for (Wire w : wiresTouching(contactId))
            removed.add(removeWire(w.id()));
        contacts.remove(contactId);
        wiresByContact.remove(contactId);
        Group g = group(c.groupId());
        g.removeContactId(contactId);
        for (String pid = g.parentId(); pid != null;) {
            Group p = groups.get(pid);
            if (p == null)
                break;
            p.removeBoundaryContactId(contactId);
            pid = p.parentId();
        }
        return removed;
    }

    /**
     * True if the contact is owned by the group or is a boundary contact of a
     * direct subgroup of it.
     */
    public boolean isVisibleIn(String contactId, String groupId) {
        Contact c = contacts.get(contactId);
        Group g = groups.get(groupId);
        if (c == null || g == null)
            return false;
        if (c.groupId().equals(groupId))
            return true;
        for (String sub : g.subgroupIds()) {
            if (group(sub).boundaryContactIds().contains(contactId))
                return true;
        }
        return false;
    }

    // ── Wires ────────────────────────────────────────────────────────

    /**
     * Determines the group that will own a wire between two contacts: the
     * deepest group in which both are visible.
     *
     * @throws IllegalArgumentException for unknown ids, self-wires, or contacts
     *                                  with no common group.
     */
    public String resolveWireGroup(String fromId, String toId) {
        Contact from = contact(fromId);
        contact(toId);
        if (fromId.equals(toId))
            throw new IllegalArgumentException("Cannot wire contact " + fromId + " to itself");
        for (String gid = from.groupId(); gid != null; gid = group(gid).parentId()) {
            if (isVisibleIn(fromId, gid) && isVisibleIn(toId, gid))
                return gid;
        }
        throw new IllegalArgumentException(
                "Contacts " + fromId + " and " + toId + " are not visible in a common group");
    }

    public Wire addWire(String wireId, String fromId, String toId, WireKind kind) {
        String groupId = resolveWireGroup(fromId, toId);
        String id = wireId != null ? wireId : nextId("wire");
        if (wires.containsKey(id))
            throw new IllegalArgumentException("Duplicate wire id: " + id);
        Wire w = new Wire(id, groupId, fromId, toId, kind == null ? WireKind.BIDIRECTIONAL : kind);
        wires.put(id, w);
        wiresByContact.computeIfAbsent(fromId, k -> new LinkedHashSet<>()).add(id);
        wiresByContact.computeIfAbsent(toId, k -> new LinkedHashSet<>()).add(id);
        group(groupId).addWireId(id);
        return w;
    }

    /**
     * @throws IllegalArgumentException if the wire does not exist.
     */
    public Wire wire(String id) {
        Wire w = wires.get(id);
        if (w == null)
            throw new IllegalArgumentException("Unknown wire: " + id);
        return w;
    }

    public Wire findWire(String id) {
        return wires.get(id);
    }

    public Collection<Wire> wires() {
        return Collections.unmodifiableCollection(wires.values());
    }

    public Wire removeWire(String wireId) {
        Wire w = wires.remove(wireId);
        if (w == null)
            throw new IllegalArgumentException("Unknown wire: " + wireId);
        unindex(w.fromId(), wireId);
        unindex(w.toId(), wireId);
        Group g = groups.get(w.groupId());
        if (g != null)
            g.removeWireId(wireId);
        return w;
    }

    private void unindex(String contactId, String wireId) {
        Set<String> ids = wiresByContact.get(contactId);
        if (ids != null) {
            ids.remove(wireId);
            if (ids.isEmpty())
                wiresByContact.remove(contactId);
        }
    }

    /** Wires with the contact at either end, in creation order. */
    public List<Wire> wiresTouching(String contactId) {
        Set<String> ids = wiresByContact.get(contactId);
        if (ids == null)
            return List.of();
        List<Wire> out = new ArrayList<>(ids.size());
        for (String id : ids)
            out.add(wires.get(id));
        return out;
    }

    // ── Gadgets ──────────────────────────────────────────────────────

    public void bindGadget(GadgetBinding binding) {
        Group g = group(binding.groupId());
        if (!g.isPrimitive())
            throw new IllegalArgumentException("Group " + g.id() + " is not a primitive group");
        gadgets.put(binding.groupId(), binding);
    }

    public GadgetBinding gadget(String groupId) {
        return gadgets.get(groupId);
    }

    /** The gadget for which the contact is an input port, or {@code null}. */
    public GadgetBinding gadgetForInput(String contactId) {
        Contact c = contacts.get(contactId);
        if (c == null)
            return null;
        GadgetBinding b = gadgets.get(c.groupId());
        return b != null && b.isInput(contactId) ? b : null;
    }

    public void clear() {
        groups.clear();
        contacts.clear();
        wires.clear();
        wiresByContact.clear();
        gadgets.clear();
    }
}
