package com.bassline.core.io;

import com.bassline.core.PropagationNetwork;
import com.bassline.core.lattice.Values;
import com.bassline.core.model.BlendMode;
import com.bassline.core.model.BoundaryDirection;
import com.bassline.core.model.ContactRecord;
import com.bassline.core.model.ContactSpec;
import com.bassline.core.model.WireKind;
import org.junit.Before;
import org.junit.Test;

import java.io.InputStream;

import static org.junit.Assert.*;

public class TopologyCompilerTest {

    private TopologyDefinition def;

    @Before
    public void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/adder-topology.json")) {
            assertNotNull("adder-topology.json missing from test resources", in);
            def = TopologyJson.parse(in);
        }
    }

    @Test
    public void testParse() {
        assertEquals("adder", def.getName());
        assertEquals(2, def.getGroups().size());
        TopologyDefinition.GroupDef calc = def.getGroups().get(0);
        assertEquals(3, calc.getContacts().size());
        assertTrue(calc.getContacts().get(0).isBoundary());
        assertEquals(Values.number(2), calc.getContacts().get(0).getContent());
        assertNull(calc.getContacts().get(2).getContent());
        assertEquals("add", calc.getSubgroups().get(0).getPrimitive());
    }

    @Test
    public void testCompileSettlesInitialValues() {
        PropagationNetwork net = new TopologyCompiler().compile(def);

        assertEquals(500, net.config().getMaxSteps());
        assertEquals(2000L, net.config().getGadgetTimeoutMillis());
        assertEquals(Values.number(5), net.getContact("calc.total").content());
        assertEquals(Values.growSet("a", "b"), net.getContact("left").content());
        assertEquals(Values.growSet("a", "b"), net.getContact("right").content());

        ContactRecord x = net.getContact("calc.x");
        assertEquals(BlendMode.ACCEPT_LAST, x.blendMode());
        assertEquals(BoundaryDirection.INPUT, x.boundaryDirection());
        assertEquals(WireKind.BIDIRECTIONAL, net.getWire("tags-link").kind());
        assertEquals("tags", net.getWire("tags-link").groupId());

        net.updateContact("calc.x", Values.number(40));
        assertEquals(Values.number(43), net.getContact("calc.total").content());
    }

    @Test
    public void testBoundaryReexport() {
        String json = "{\"groups\":[{\"id\":\"outer\",\"contacts\":[{\"name\":\"out\"}],"
                + "\"subgroups\":[{\"id\":\"inner\",\"contacts\":[{\"name\":\"v\",\"boundary\":true,\"direction\":\"output\"}],"
                + "\"subgroups\":[{\"id\":\"neg\",\"primitive\":\"negate\"}],"
                + "\"wires\":[{\"from\":\"neg.result\",\"to\":\"inner.v\",\"kind\":\"directed\"}],"
                + "\"boundary\":[\"neg.value\"]}],"
                + "\"wires\":[{\"from\":\"inner.v\",\"to\":\"outer.out\",\"kind\":\"directed\"}],"
                + "\"boundary\":[\"neg.value\"]}]}";
        PropagationNetwork net = new TopologyCompiler().compile(TopologyJson.parse(json));

        // neg.value is re-exported twice, so the root can wire to it.
        String src = net.addContact(net.rootGroupId(), ContactSpec.acceptLast("src"));
        assertEquals("root", net.getWire(net.connect(src, "neg.value", WireKind.DIRECTED)).groupId());
        net.updateContact(src, Values.number(3));
        assertEquals(Values.number(-3), net.getContact("outer.out").content());
    }

    @Test
    public void testWireDeclaredInWrongGroupIsRejected() {
        String json = "{\"groups\":[{\"id\":\"a\",\"contacts\":[{\"name\":\"x\",\"boundary\":true}]},"
                + "{\"id\":\"c\",\"contacts\":[{\"name\":\"z\",\"boundary\":true}],"
                + "\"wires\":[{\"from\":\"c.z\",\"to\":\"a.x\"}]}]}";
        // c.z and a.x only meet in the root.
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new TopologyCompiler().compile(TopologyJson.parse(json)));
        assertTrue(e.getMessage(), e.getMessage().contains("meet in root"));
    }

    @Test
    public void testUnknownGadget() {
        String json = "{\"groups\":[{\"id\":\"g\",\"primitive\":\"warp-drive\"}]}";
        assertThrows(IllegalArgumentException.class, () -> new TopologyCompiler().compile(TopologyJson.parse(json)));
    }

    @Test
    public void testPrimitiveGroupCannotDeclareContacts() {
        String json = "{\"groups\":[{\"id\":\"g\",\"primitive\":\"add\",\"contacts\":[{\"name\":\"x\"}]}]}";
        assertThrows(IllegalArgumentException.class, () -> new TopologyCompiler().compile(TopologyJson.parse(json)));
    }

    @Test
    public void testRootGroupCanBeFilled() {
        String json = "{\"root\":\"main\",\"groups\":[{\"id\":\"main\",\"contacts\":[{\"name\":\"a\"},{\"name\":\"b\"}],"
                + "\"wires\":[{\"from\":\"main.a\",\"to\":\"main.b\"}]}]}";
        PropagationNetwork net = new TopologyCompiler().compile(TopologyJson.parse(json));
        assertEquals("main", net.rootGroupId());
        net.updateContact("main.b", Values.growSet(1));
        assertEquals(Values.growSet(1), net.getContact("main.a").content());
    }
}
