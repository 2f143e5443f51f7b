package com.bassline.core.engine;

import com.bassline.core.model.ContactSpec;
import com.bassline.core.model.GroupSpec;
import com.bassline.core.model.Wire;
import com.bassline.core.model.WireKind;
import com.bassline.core.model.BlendMode;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GroupArenaTest {

    private GroupArena arena;

    @Before
    public void setUp() {
        arena = new GroupArena();
        // root
        // ├── left  (in: boundary, hidden: internal)
        // │   └── inner (deep: boundary)
        // └── right (in: boundary)
        arena.addGroup(GroupSpec.root("root", "root"));
        arena.addGroup(GroupSpec.child("left", "left", "root"));
        arena.addGroup(GroupSpec.child("right", "right", "root"));
        arena.addGroup(GroupSpec.child("inner", "inner", "left"));
        arena.addContact("root", ContactSpec.merge("r").withId("r"));
        arena.addContact("left", ContactSpec.input("in", BlendMode.MERGE).withId("left.in"));
        arena.addContact("left", ContactSpec.merge("hidden").withId("left.hidden"));
        arena.addContact("right", ContactSpec.input("in", BlendMode.MERGE).withId("right.in"));
        arena.addContact("inner", ContactSpec.output("deep", BlendMode.MERGE).withId("inner.deep"));
    }

    @Test
    public void testVisibility() {
        assertTrue(arena.isVisibleIn("r", "root"));
        assertTrue(arena.isVisibleIn("left.in", "root"));
        assertFalse(arena.isVisibleIn("left.hidden", "root"));
        assertTrue(arena.isVisibleIn("inner.deep", "left"));
        assertFalse(arena.isVisibleIn("inner.deep", "root"));
    }

    @Test
    public void testWireGroupResolution() {
        assertEquals("root", arena.resolveWireGroup("r", "left.in"));
        assertEquals("root", arena.resolveWireGroup("left.in", "r"));
        assertEquals("root", arena.resolveWireGroup("left.in", "right.in"));
        assertEquals("left", arena.resolveWireGroup("left.hidden", "left.in"));
        assertEquals("left", arena.resolveWireGroup("inner.deep", "left.hidden"));
    }

    @Test
    public void testInvalidWires() {
        assertThrows(IllegalArgumentException.class, () -> arena.addWire(null, "r", "r", WireKind.DIRECTED));
        assertThrows(IllegalArgumentException.class, () -> arena.addWire(null, "r", "left.hidden", null));
        assertThrows(IllegalArgumentException.class, () -> arena.addWire(null, "r", "nope", null));
        assertThrows(IllegalArgumentException.class, () -> arena.addWire(null, "r", "inner.deep", null));
    }

    @Test
    public void testReExportMakesDeepContactVisible() {
        arena.exposeBoundary("left", "inner.deep");
        assertTrue(arena.isVisibleIn("inner.deep", "root"));
        Wire w = arena.addWire(null, "inner.deep", "r", WireKind.DIRECTED);
        assertEquals("root", w.groupId());

        // Not a boundary of any direct subgroup of root.
        assertThrows(IllegalArgumentException.class, () -> arena.exposeBoundary("root", "left.hidden"));
        // Own contact that is not flagged as boundary.
        assertThrows(IllegalArgumentException.class, () -> arena.exposeBoundary("left", "left.hidden"));
    }

    @Test
    public void testWireIndex() {
        Wire w1 = arena.addWire("w1", "r", "left.in", WireKind.BIDIRECTIONAL);
        Wire w2 = arena.addWire("w2", "right.in", "r", WireKind.DIRECTED);
        assertEquals(List.of(w1, w2), arena.wiresTouching("r"));
        assertEquals(List.of("w1", "w2"), List.copyOf(arena.group("root").wireIds()));

        arena.removeWire("w1");
        assertEquals(List.of(w2), arena.wiresTouching("r"));
        assertTrue(arena.wiresTouching("left.in").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> arena.removeWire("w1"));
        assertThrows(IllegalArgumentException.class, () -> arena.addWire("w2", "r", "left.in", null));
    }

    @Test
    public void testRemoveContactDropsItsWires() {
        arena.addWire("w1", "r", "left.in", WireKind.BIDIRECTIONAL);
        List<Wire> removed = arena.removeContact("left.in");
        assertEquals(1, removed.size());
        assertNull(arena.findWire("w1"));
        assertNull(arena.findContact("left.in"));
        assertFalse(arena.group("left").boundaryContactIds().contains("left.in"));
        assertTrue(arena.wiresTouching("r").isEmpty());
    }

    @Test
    public void testRemoveGroupCascades() {
        arena.exposeBoundary("left", "inner.deep");
        arena.addWire("w1", "r", "left.in", WireKind.BIDIRECTIONAL);
        arena.addWire("w2", "inner.deep", "r", WireKind.DIRECTED);
        arena.addWire("w3", "left.hidden", "left.in", WireKind.DIRECTED);

        List<Wire> removed = arena.removeGroup("left");

        assertEquals(3, removed.size());
        assertFalse(arena.hasGroup("left"));
        assertFalse(arena.hasGroup("inner"));
        assertNull(arena.findContact("inner.deep"));
        assertTrue(arena.group("root").wireIds().isEmpty());
        assertEquals(List.of("right"), List.copyOf(arena.group("root").subgroupIds()));
        assertTrue(arena.wiresTouching("r").isEmpty());
    }

    @Test
    public void testSubtreeOrderAndDuplicates() {
        assertEquals(List.of("root", "left", "inner", "right"), arena.subtree("root"));
        assertThrows(IllegalArgumentException.class, () -> arena.addGroup(GroupSpec.child("left", "x", "root")));
        assertThrows(IllegalArgumentException.class, () -> arena.addGroup(GroupSpec.child("x", "x", "missing")));
        assertThrows(IllegalArgumentException.class, () -> arena.addContact("root", ContactSpec.merge("r").withId("r")));
    }

    @Test
    public void testGeneratedIdsAreUnique() {
        String a = arena.addContact("root", ContactSpec.merge("a")).id();
        String b = arena.addContact("root", ContactSpec.merge("b")).id();
        assertNotEquals(a, b);
    }

    @Test
    public void testRemoveGroupWithdrawsReexportsFromAllAncestors() {
        arena.addGroup(GroupSpec.child("mid", "mid", "inner"));
        arena.addContact("mid", ContactSpec.output("out", BlendMode.MERGE).withId("mid.out"));
        arena.exposeBoundary("inner", "mid.out");
        arena.exposeBoundary("left", "mid.out");
        assertTrue(arena.isVisibleIn("mid.out", "root"));

        arena.removeGroup("mid");

        assertFalse(arena.group("inner").boundaryContactIds().contains("mid.out"));
        assertFalse(arena.group("left").boundaryContactIds().contains("mid.out"));
        assertEquals(List.of("left.in"), List.copyOf(arena.group("left").boundaryContactIds()));
        assertFalse(arena.isVisibleIn("mid.out", "root"));
    }
}
