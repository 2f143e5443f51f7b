package com.bassline.core.gadget.primitives;

import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;
import com.bassline.core.lattice.BoolValue;
import com.bassline.core.lattice.LatticeValue;
import com.bassline.core.lattice.NumberValue;
import com.bassline.core.lattice.Values;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class PrimitiveGadgetsTest {

    private final GadgetRegistry registry = new GadgetRegistry();

    private Map<String, LatticeValue> run(String gadgetId, Object... portsAndValues) {
        Map<String, LatticeValue> inputs = new HashMap<>();
        for (int i = 0; i < portsAndValues.length; i += 2)
            inputs.put((String) portsAndValues[i], Values.of(portsAndValues[i + 1]));
        return registry.lookup(gadgetId).body().apply(inputs).join();
    }

    @Test
    public void testMath() {
        assertEquals(Values.number(5), run("add", "a", 2, "b", 3).get("sum"));
        assertEquals(Values.number(-1), run("subtract", "a", 2, "b", 3).get("difference"));
        assertEquals(Values.number(6), run("multiply", "a", 2, "b", 3).get("product"));
        assertEquals(Values.number(2.5), run("divide", "a", 5, "b", 2).get("quotient"));
        assertEquals(Values.number(2), run("min", "a", 2, "b", 3).get("result"));
        assertEquals(Values.number(3), run("max", "a", 2, "b", 3).get("result"));
        assertEquals(Values.number(-4), run("negate", "value", 4).get("result"));
        assertEquals(Values.number(4), run("abs", "value", -4).get("result"));
        assertEquals(Values.number(3), run("sqrt", "value", 9).get("result"));
    }

    @Test
    public void testDivisionByZeroEmitsNothing() {
        assertTrue(run("divide", "a", 1, "b", 0).isEmpty());
    }

    @Test
    public void testWrongInputTypeFails() {
        assertThrows(IllegalArgumentException.class, () -> run("add", "a", "two", "b", 3));
        assertThrows(IllegalArgumentException.class, () -> run("sqrt", "value", -1));
    }

    @Test
    public void testLogic() {
        assertEquals(BoolValue.FALSE, run("and", "a", true, "b", false).get("result"));
        assertEquals(BoolValue.TRUE, run("or", "a", true, "b", false).get("result"));
        assertEquals(BoolValue.TRUE, run("xor", "a", true, "b", false).get("result"));
        assertEquals(BoolValue.FALSE, run("not", "value", true).get("result"));
    }

    @Test
    public void testGate() {
        GadgetSpec gate = registry.lookup("gate");
        assertTrue(gate.activation().isReady(Set.of("value")));
        assertTrue(run("gate", "value", 7).isEmpty());
        assertTrue(run("gate", "value", 7, "enabled", false).isEmpty());
        assertEquals(Values.number(7), run("gate", "value", 7, "enabled", true).get("result"));
    }

    @Test
    public void testStrings() {
        assertEquals(Values.string("ab"), run("concat", "a", "a", "b", "b").get("result"));
        assertEquals(Values.string("a"), run("concat", "a", "a").get("result"));
        assertEquals(Values.string("x3"), run("concat", "a", "x", "b", 3).get("result"));
        assertEquals(Values.string("HI"), run("uppercase", "value", "hi").get("result"));
        assertEquals(Values.string("hi"), run("lowercase", "value", "HI").get("result"));
        assertEquals(Values.string("hi"), run("trim", "value", "  hi ").get("result"));
        assertEquals(Values.number(2), run("length", "value", "hi").get("result"));
    }

    @Test
    public void testComparison() {
        assertEquals(BoolValue.TRUE, run("eq", "a", 1, "b", 1.0).get("result"));
        assertEquals(BoolValue.FALSE, run("eq", "a", "1", "b", 1).get("result"));
        assertEquals(BoolValue.TRUE, run("lt", "a", 1, "b", 2).get("result"));
        assertEquals(BoolValue.FALSE, run("gt", "a", 1, "b", 2).get("result"));
    }

    @Test
    public void testCollections() {
        Map<String, LatticeValue> in = new HashMap<>();
        in.put("a", Values.growSet(1, 2));
        in.put("b", Values.array(2, 3));
        assertEquals(Values.growSet(1, 2, 3), registry.lookup("union").body().apply(in).join().get("result"));

        in.remove("b");
        assertEquals(Values.growSet(1, 2), registry.lookup("union").body().apply(in).join().get("result"));

        Map<String, LatticeValue> arr = Map.of("value", Values.array(1, 1, 2));
        assertEquals(Values.number(3), registry.lookup("size").body().apply(arr).join().get("result"));
        assertEquals(Values.growSet(1, 2), registry.lookup("to-grow-set").body().apply(arr).join().get("result"));
    }

    @Test
    public void testTimestampIsImpure() {
        GadgetSpec ts = registry.lookup("timestamp");
        assertFalse(ts.pure());
        LatticeValue time = run("timestamp", "trigger", true).get("time");
        assertTrue(time instanceof NumberValue);
        assertTrue(((NumberValue) time).value() > 0);
    }
}
