package com.bassline.core.io;

import com.bassline.core.lattice.DictValue;
import com.bassline.core.lattice.LatticeValue;
import com.bassline.core.lattice.NoneValue;
import com.bassline.core.lattice.Values;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class LatticeJsonTest {

    private final ObjectMapper mapper = SnapshotJson.createMapper();

    private JsonNode parse(String json) throws Exception {
        return mapper.readTree(json);
    }

    @Test
    public void testScalars() throws Exception {
        assertEquals("3", LatticeJson.toJson(Values.number(3)).toString());
        assertEquals("2.5", LatticeJson.toJson(Values.number(2.5)).toString());
        assertEquals("\"x\"", LatticeJson.toJson(Values.string("x")).toString());
        assertEquals("true", LatticeJson.toJson(Values.bool(true)).toString());

        assertEquals(Values.number(3), LatticeJson.fromJson(parse("3")));
        assertEquals(Values.number(3), LatticeJson.fromJson(parse("3.0")));
        assertEquals(Values.string("x"), LatticeJson.fromJson(parse("\"x\"")));
    }

    @Test
    public void testTaggedCollections() throws Exception {
        JsonNode grow = LatticeJson.toJson(Values.growSet("a", "b"));
        assertEquals("GrowSet", grow.get(LatticeJson.TAG).asText());
        assertEquals(2, grow.get("values").size());

        JsonNode arr = LatticeJson.toJson(Values.shrinkArray(1, 2));
        assertEquals("ShrinkArray", arr.get(LatticeJson.TAG).asText());
        assertEquals(2, arr.get("items").size());

        JsonNode map = LatticeJson.toJson(Values.growMap(Map.of("k", 1)));
        assertEquals(1, map.get("entries").get("k").asInt());

        assertEquals(Values.shrinkSet(1, 2),
                LatticeJson.fromJson(parse("{\"_tag\":\"ShrinkSet\",\"values\":[1,2]}")));
        assertEquals(Values.growArray("x", "x"),
                LatticeJson.fromJson(parse("{\"_tag\":\"GrowArray\",\"items\":[\"x\",\"x\"]}")));
        assertEquals(Values.set(1), LatticeJson.fromJson(parse("{\"_tag\":\"Set\",\"values\":[1]}")));
    }

    @Test
    public void testPlainJsonBecomesDictAndArray() throws Exception {
        LatticeValue v = LatticeJson.fromJson(parse("{\"a\":[1,\"two\"],\"b\":{\"c\":false}}"));
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("a", List.of(1, "two"));
        expected.put("b", Map.of("c", false));
        assertEquals(Values.dict(expected), v);
    }

    @Test
    public void testNullHandling() throws Exception {
        assertNull(LatticeJson.fromJson(null));
        assertNull(LatticeJson.fromJson(parse("null")));
        assertTrue(LatticeJson.toJson(null).isNull());

        assertEquals(Values.array(NoneValue.INSTANCE, 1), LatticeJson.fromJson(parse("[null,1]")));
        assertEquals("{\"_tag\":\"None\"}", LatticeJson.toJson(NoneValue.INSTANCE).toString());
        assertSame(NoneValue.INSTANCE, LatticeJson.fromJson(parse("{\"_tag\":\"None\"}")));
    }

    @Test
    public void testDictWithTagKeyIsWrapped() throws Exception {
        DictValue tricky = Values.dict(Map.of(LatticeJson.TAG, "GrowSet"));
        JsonNode node = LatticeJson.toJson(tricky);
        assertEquals("Dict", node.get(LatticeJson.TAG).asText());
        assertEquals(tricky, LatticeJson.fromJson(node));
    }

    @Test
    public void testMalformedTaggedObjects() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> LatticeJson.fromJson(parse("{\"_tag\":\"Bogus\",\"values\":[]}")));
        assertThrows(IllegalArgumentException.class,
                () -> LatticeJson.fromJson(parse("{\"_tag\":\"GrowSet\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> LatticeJson.fromJson(parse("{\"_tag\":\"GrowMap\",\"entries\":[1]}")));
    }

    @Test
    public void testModuleRoundTripsNestedValues() throws Exception {
        LatticeValue nested = Values.growMap(Map.of("tags", Values.growSet("a"), "n", Values.number(1.5)));
        String json = mapper.writeValueAsString(nested);
        assertEquals(nested, mapper.readValue(json, LatticeValue.class));
    }

    @Test
    public void testLargeNumbersKeepTheirValue() throws Exception {
        for (double v : new double[] { 1e20, -1e20, 1e300, 9.223372036854775807E18, 9.007199254740992E15 }) {
            JsonNode json = LatticeJson.toJson(Values.number(v));
            assertEquals(Values.number(v), LatticeJson.fromJson(parse(json.toString())));
        }
        assertEquals("9007199254740991", LatticeJson.toJson(Values.number(9007199254740991.0)).toString());
        assertEquals("-42", LatticeJson.toJson(Values.number(-42)).toString());
    }

    @Test
    public void testNegativeZeroIsWrittenAsZero() throws Exception {
        assertEquals("0", LatticeJson.toJson(Values.number(-0.0)).toString());
        assertEquals(Values.number(0), LatticeJson.fromJson(parse("-0.0")));
    }
}
