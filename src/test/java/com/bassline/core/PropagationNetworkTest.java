package com.bassline.core;

import com.bassline.core.api.ChangeType;
import com.bassline.core.api.NetworkChange;
import com.bassline.core.api.Subscription;
import com.bassline.core.engine.PropagationResult;
import com.bassline.core.engine.SchedulerConfig;
import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;
import com.bassline.core.io.NetworkSnapshot;
import com.bassline.core.lattice.NumberValue;
import com.bassline.core.lattice.Values;
import com.bassline.core.model.BlendMode;
import com.bassline.core.model.ContactSpec;
import com.bassline.core.model.GroupSpec;
import com.bassline.core.model.GroupState;
import com.bassline.core.model.WireKind;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PropagationNetworkTest {

    private PropagationNetwork net;
    private String root;

    @Before
    public void setUp() {
        net = new PropagationNetwork();
        root = net.rootGroupId();
    }

    /** Root contact src, group calc with input x and an adder reading x and y. */
    private void buildCalc() {
        net.registerGroup(GroupSpec.child("calc", "Calculator", root));
        net.addContact("calc", ContactSpec.input("x", BlendMode.ACCEPT_LAST).withId("calc.x"));
        net.addContact("calc", ContactSpec.acceptLast("y").withId("calc.y"));
        net.registerGroup(GroupSpec.primitive("adder", "calc", "add"));
        net.addContact(root, ContactSpec.acceptLast("src").withId("src"));
        net.connect("src", "calc.x", WireKind.DIRECTED);
        net.connect("calc.x", "adder.a", WireKind.DIRECTED);
        net.connect("calc.y", "adder.b", WireKind.DIRECTED);
    }

    @Test
    public void testMergeFlowsBothWays() {
        String a = net.addContact(root, ContactSpec.merge("a"));
        String b = net.addContact(root, ContactSpec.merge("b"));
        net.connect(a, b);

        net.updateContact(a, Values.growSet("x"));
        net.updateContact(b, Values.growSet("y"));

        assertEquals(Values.growSet("x", "y"), net.getContact(a).content());
        assertEquals(Values.growSet("x", "y"), net.getContact(b).content());
    }

    @Test
    public void testGadgetThroughBoundary() {
        buildCalc();
        net.updateContact("calc.y", Values.number(1));
        PropagationResult r = net.updateContact("src", Values.number(41));

        assertTrue(r.isClean());
        assertTrue(r.changed("adder.sum"));
        assertEquals(Values.number(42), net.getContact("adder.sum").content());
    }

    @Test
    public void testHiddenContactsCannotBeWiredFromOutside() {
        buildCalc();
        assertThrows(IllegalArgumentException.class, () -> net.connect("src", "calc.y", WireKind.DIRECTED));
        assertThrows(IllegalArgumentException.class, () -> net.connect("src", "adder.a", WireKind.DIRECTED));
        assertThrows(IllegalArgumentException.class, () -> net.connect("src", "src", WireKind.DIRECTED));
        assertThrows(IllegalArgumentException.class, () -> net.connect("src", "nope", WireKind.DIRECTED));
    }

    @Test
    public void testReexportedPortIsVisibleToParent() {
        buildCalc();
        net.exposeBoundary("calc", "adder.sum");
        String out = net.addContact(root, ContactSpec.acceptLast("out"));
        String w = net.connect("adder.sum", out, WireKind.DIRECTED);
        assertEquals(root, net.getWire(w).groupId());

        net.updateContact("calc.y", Values.number(2));
        net.updateContact("src", Values.number(3));
        assertEquals(Values.number(5), net.getContact(out).content());
    }

    @Test
    public void testConnectOnlyQueuesExistingValues() {
        String a = net.addContact(root, ContactSpec.merge("a"));
        String b = net.addContact(root, ContactSpec.merge("b"));
        net.updateContact(a, Values.growSet(1));

        net.connect(a, b, WireKind.DIRECTED);
        assertNull(net.getContact(b).content());
        net.propagate();
        assertEquals(Values.growSet(1), net.getContact(b).content());
    }

    @Test
    public void testInitialContentPropagates() {
        String a = net.addContact(root, ContactSpec.merge("a").withContent(Values.growSet("seed")));
        String b = net.addContact(root, ContactSpec.merge("b"));
        net.connect(a, b);
        net.propagate();
        assertEquals(Values.growSet("seed"), net.getContact(b).content());
    }

    @Test
    public void testStructuralChangesAreReported() {
        List<NetworkChange> seen = new ArrayList<>();
        net.subscribe(root, seen::addAll);

        String a = net.addContact(root, ContactSpec.merge("a"));
        String b = net.addContact(root, ContactSpec.merge("b"));
        String w = net.connect(a, b);
        String g = net.addGroup(root, "child");
        net.removeWire(w);
        net.removeContact(b);

        assertEquals(List.of(
                NetworkChange.of(ChangeType.CONTACT_ADDED, root, a),
                NetworkChange.of(ChangeType.CONTACT_ADDED, root, b),
                NetworkChange.of(ChangeType.WIRE_ADDED, root, w),
                NetworkChange.of(ChangeType.GROUP_ADDED, root, g),
                NetworkChange.of(ChangeType.WIRE_REMOVED, root, w),
                NetworkChange.of(ChangeType.CONTACT_REMOVED, root, b)), seen);
    }

    @Test
    public void testContactUpdatesAreBatchedPerGroup() {
        buildCalc();
        List<List<NetworkChange>> rootBatches = new ArrayList<>();
        List<List<NetworkChange>> calcBatches = new ArrayList<>();
        net.subscribe(root, rootBatches::add);
        net.subscribe("calc", calcBatches::add);

        net.updateContact("src", Values.number(7));

        assertEquals(1, rootBatches.size());
        assertEquals(List.of(
                new NetworkChange(ChangeType.CONTACT_UPDATED, root, "src", Values.number(7)),
                new NetworkChange(ChangeType.CONTACT_UPDATED, root, "calc.x", Values.number(7))),
                rootBatches.get(0));
        assertEquals(1, calcBatches.size());
        assertEquals(List.of(
                new NetworkChange(ChangeType.CONTACT_UPDATED, "calc", "calc.x", Values.number(7)),
                new NetworkChange(ChangeType.CONTACT_UPDATED, "calc", "adder.a", Values.number(7))),
                calcBatches.get(0));
    }

    @Test
    public void testClosedSubscriptionStopsDelivery() {
        List<NetworkChange> seen = new ArrayList<>();
        Subscription sub = net.subscribe(root, seen::addAll);
        net.addContact(root, ContactSpec.merge("a"));
        sub.close();
        sub.close();
        net.addContact(root, ContactSpec.merge("b"));
        assertEquals(1, seen.size());
    }

    @Test
    public void testFailingListenerDoesNotAffectNetwork() {
        List<NetworkChange> seen = new ArrayList<>();
        net.subscribe(root, changes -> {
            throw new IllegalStateException("listener bug");
        });
        net.subscribe(root, seen::addAll);

        String a = net.addContact(root, ContactSpec.merge("a"));
        net.updateContact(a, Values.growSet(1));

        assertEquals(2, seen.size());
        assertEquals(Values.growSet(1), net.getContact(a).content());
    }

    @Test
    public void testRemoveGroupCascades() {
        buildCalc();
        List<NetworkChange> rootSeen = new ArrayList<>();
        List<NetworkChange> calcSeen = new ArrayList<>();
        net.subscribe(root, rootSeen::addAll);
        net.subscribe("calc", calcSeen::addAll);

        net.removeGroup("calc");

        assertNull(net.getContact("calc.x"));
        assertNull(net.getContact("adder.sum"));
        assertTrue(net.wiresTouching("src").isEmpty());
        assertTrue(net.getState(root).group().subgroupIds().isEmpty());
        assertEquals(List.of(NetworkChange.of(ChangeType.GROUP_REMOVED, "calc", "calc")), calcSeen);
        assertEquals(ChangeType.WIRE_REMOVED, rootSeen.get(0).type());
        assertEquals(NetworkChange.of(ChangeType.GROUP_REMOVED, root, "calc"), rootSeen.get(rootSeen.size() - 1));

        // Removed contacts no longer take part in propagation.
        assertTrue(net.updateContact("src", Values.number(1)).isClean());
    }

    @Test
    public void testInvalidRemovals() {
        buildCalc();
        assertThrows(IllegalArgumentException.class, () -> net.removeGroup(root));
        assertThrows(IllegalArgumentException.class, () -> net.removeGroup("nope"));
        assertThrows(IllegalArgumentException.class, () -> net.removeContact("adder.a"));
        assertThrows(IllegalArgumentException.class, () -> net.removeWire("nope"));
        assertThrows(IllegalArgumentException.class,
                () -> net.addContact("adder", ContactSpec.merge("extra")));
    }

    @Test
    public void testRegisterGroupWithoutParentGoesUnderRoot() {
        String id = net.registerGroup(new GroupSpec(null, "loose", null, null));
        assertEquals(root, net.getState(id).group().parentId());
        assertEquals(List.of(id), net.getState(root).group().subgroupIds());
    }

    @Test
    public void testGetState() {
        buildCalc();
        GroupState calc = net.getState("calc");
        assertEquals("Calculator", calc.group().name());
        assertEquals(List.of("calc.x", "calc.y"), List.copyOf(calc.contacts().keySet()));
        assertEquals(2, calc.wires().size());
        assertEquals(List.of("calc.x"), calc.group().boundaryContactIds());
        assertThrows(IllegalArgumentException.class, () -> net.getState("nope"));

        GroupState adder = net.getState("adder");
        assertEquals("add", adder.group().primitiveId());
        assertEquals(List.of("adder.a", "adder.b", "adder.sum"), List.copyOf(adder.contacts().keySet()));
    }

    @Test
    public void testFlattenSubtree() {
        buildCalc();
        NetworkSnapshot snap = net.flatten("calc");
        assertEquals("calc", snap.rootGroupId());
        assertEquals(List.of("calc", "adder"), List.copyOf(snap.groups().keySet()));
        assertEquals(5, snap.contactCount());
    }

    @Test
    public void testImportSnapshotReplacesNetwork() {
        buildCalc();
        net.updateContact("calc.y", Values.number(1));
        net.updateContact("src", Values.number(1));
        NetworkSnapshot snap = net.flatten();

        PropagationNetwork other = new PropagationNetwork();
        List<NetworkChange> seen = new ArrayList<>();
        other.subscribe(other.rootGroupId(), seen::addAll);
        other.addContact(other.rootGroupId(), ContactSpec.merge("old").withId("old"));
        seen.clear();

        other.importSnapshot(snap);

        assertNull(other.getContact("old"));
        assertEquals(Values.number(2), other.getContact("adder.sum").content());
        assertEquals(List.of(NetworkChange.of(ChangeType.GROUP_UPDATED, root, root)), seen);
        other.updateContact("src", Values.number(10));
        assertEquals(Values.number(11), other.getContact("adder.sum").content());
    }

    @Test
    public void testImportWithUnknownGadgetChangesNothing() {
        GadgetRegistry custom = new GadgetRegistry().register(GadgetSpec.strict("twice", "custom",
                "Doubles", List.of("value"), List.of("result"),
                in -> Map.of("result", Values.number(2 * ((NumberValue) in.get("value")).value()))));
        PropagationNetwork source = new PropagationNetwork(custom, SchedulerConfig.defaults());
        source.createPrimitiveGadget(source.rootGroupId(), "twice");
        NetworkSnapshot snap = source.flatten();

        String a = net.addContact(root, ContactSpec.merge("a"));
        net.updateContact(a, Values.growSet(1));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> net.importSnapshot(snap));
        assertEquals("Unknown gadget: twice", e.getMessage());
        assertEquals(Values.growSet(1), net.getContact(a).content());
        assertEquals(root, net.rootGroupId());
    }

    @Test
    public void testRemovingNestedGadgetKeepsSnapshotImportable() {
        net.registerGroup(GroupSpec.child("outer", "outer", root));
        net.registerGroup(GroupSpec.child("mid", "mid", "outer"));
        net.registerGroup(GroupSpec.primitive("adder", "mid", "add"));
        net.exposeBoundary("mid", "adder.sum");
        net.exposeBoundary("outer", "adder.sum");

        net.removeGroup("adder");

        assertTrue(net.getState("mid").group().boundaryContactIds().isEmpty());
        assertTrue(net.getState("outer").group().boundaryContactIds().isEmpty());
        NetworkSnapshot snap = net.flatten();
        PropagationNetwork other = new PropagationNetwork();
        other.importSnapshot(snap);
        assertTrue(other.getState("outer").group().boundaryContactIds().isEmpty());
        assertEquals(List.of("mid"), List.copyOf(other.getState("outer").group().subgroupIds()));
    }

    @Test
    public void testGadgetPortClashLeavesNoPartialGroup() {
        net.addContact(root, ContactSpec.merge("a").withId("g.a"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> net.registerGroup(GroupSpec.primitive("g", root, "add")));
        assertEquals("Duplicate contact id: g.a", e.getMessage());
        assertTrue(net.getState(root).group().subgroupIds().isEmpty());
        assertNull(net.getContact("g.b"));
        assertNull(net.getContact("g.sum"));
        assertThrows(IllegalArgumentException.class, () -> net.getState("g"));

        String id = net.registerGroup(GroupSpec.primitive("g2", root, "add"));
        assertEquals(List.of(id), List.copyOf(net.getState(root).group().subgroupIds()));
        assertNotNull(net.getContact("g2.sum"));
    }
}
