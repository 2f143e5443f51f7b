package com.bassline.core.io;

import com.bassline.core.lattice.BoolValue;
import com.bassline.core.lattice.DictValue;
import com.bassline.core.lattice.ElementCollection;
import com.bassline.core.lattice.GrowArray;
import com.bassline.core.lattice.GrowMap;
import com.bassline.core.lattice.GrowSet;
import com.bassline.core.lattice.KeyedCollection;
import com.bassline.core.lattice.LatticeValue;
import com.bassline.core.lattice.NoneValue;
import com.bassline.core.lattice.NumberValue;
import com.bassline.core.lattice.PlainArray;
import com.bassline.core.lattice.PlainSet;
import com.bassline.core.lattice.ShrinkArray;
import com.bassline.core.lattice.ShrinkMap;
import com.bassline.core.lattice.ShrinkSet;
import com.bassline.core.lattice.StringValue;
import com.bassline.core.lattice.ValueKind;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of lattice values.
 *
 * <pre>
 * 3, "x", true                              scalars
 * {"a": 1}                                  DictValue
 * [1, 2]                                    PlainArray
 * {"_tag": "None"}                          NoneValue
 * {"_tag": "Set", "values": [...]}          PlainSet
 * {"_tag": "GrowSet", "values": [...]}      GrowSet / ShrinkSet
 * {"_tag": "GrowArray", "items": [...]}     GrowArray / ShrinkArray
 * {"_tag": "GrowMap", "entries": {...}}     GrowMap / ShrinkMap
 * {"_tag": "Dict", "entries": {...}}        DictValue that itself has a "_tag" key
 * </pre>
 *
 * A top-level JSON {@code null} decodes to {@code null} (an unset contact);
 * inside a collection it decodes to {@link NoneValue}.
 */
public final class LatticeJson {
    public static final String TAG = "_tag";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    /** 2^53; integral doubles below this magnitude are written as JSON integers. */
    private static final double EXACT_LONG_LIMIT = 9.007199254740992E15;

    private LatticeJson() {
        // Utility class
    }

    public static JsonNode toJson(LatticeValue value) {
        if (value == null)
            return NODES.nullNode();
        switch (value.kind()) {
            case NONE:
                return tagged(ValueKind.NONE);
            case BOOL:
                return NODES.booleanNode(((BoolValue) value).value());
            case NUMBER: {
                NumberValue n = (NumberValue) value;
                return n.isIntegral() && Math.abs(n.value()) < EXACT_LONG_LIMIT
                        ? NODES.numberNode((long) n.value())
                        : NODES.numberNode(n.value());
            }
            case STRING:
                return NODES.textNode(((StringValue) value).value());
            case DICT: {
                DictValue d = (DictValue) value;
                ObjectNode obj = entriesNode(d.entries());
                if (!d.entries().containsKey(TAG))
                    return obj;
                ObjectNode wrapped = tagged(ValueKind.DICT);
                wrapped.set("entries", obj);
                return wrapped;
            }
            case ARRAY:
                return elementsNode(((PlainArray) value).items());
            case SET:
            case GROW_SET:
            case SHRINK_SET: {
                ObjectNode obj = tagged(value.kind());
                obj.set("values", elementsNode(((ElementCollection) value).elements()));
                return obj;
            }
            case GROW_ARRAY:
            case SHRINK_ARRAY: {
                ObjectNode obj = tagged(value.kind());
                obj.set("items", elementsNode(((ElementCollection) value).elements()));
                return obj;
            }
            case GROW_MAP:
            case SHRINK_MAP: {
                ObjectNode obj = tagged(value.kind());
                obj.set("entries", entriesNode(((KeyedCollection) value).entries()));
                return obj;
            }
            default:
                throw new IllegalArgumentException("Unsupported value kind: " + value.kind());
        }
    }

    /**
     * @return The decoded value, or {@code null} for a JSON null or missing
     *         node.
     * @throws IllegalArgumentException for unknown tags or malformed tagged
     *                                  objects.
     */
    public static LatticeValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return null;
        return read(node);
    }

    private static LatticeValue read(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return NoneValue.INSTANCE;
        if (node.isBoolean())
            return BoolValue.of(node.booleanValue());
        if (node.isNumber())
            return NumberValue.of(node.doubleValue());
        if (node.isTextual())
            return StringValue.of(node.textValue());
        if (node.isArray())
            return new PlainArray(readElements(node));
        if (node.isObject()) {
            JsonNode tag = node.get(TAG);
            if (tag == null || !tag.isTextual())
                return new DictValue(readEntries(node));
            return readTagged(ValueKind.fromTag(tag.textValue()), node);
        }
        throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
    }

    private static LatticeValue readTagged(ValueKind kind, JsonNode node) {
        switch (kind) {
            case NONE:
                return NoneValue.INSTANCE;
            case DICT:
                return new DictValue(readEntries(require(node, "entries", kind)));
            case SET:
                return new PlainSet(new LinkedHashSet<>(readElements(require(node, "values", kind))));
            case GROW_SET:
                return new GrowSet(new LinkedHashSet<>(readElements(require(node, "values", kind))));
            case SHRINK_SET:
                return new ShrinkSet(new LinkedHashSet<>(readElements(require(node, "values", kind))));
            case GROW_ARRAY:
                return new GrowArray(readElements(require(node, "items", kind)));
            case SHRINK_ARRAY:
                return new ShrinkArray(readElements(require(node, "items", kind)));
            case GROW_MAP:
                return new GrowMap(readEntries(require(node, "entries", kind)));
            case SHRINK_MAP:
                return new ShrinkMap(readEntries(require(node, "entries", kind)));
            default:
                throw new IllegalArgumentException("Tag '" + kind.tag() + "' is written as a plain JSON value");
        }
    }

    private static JsonNode require(JsonNode node, String field, ValueKind kind) {
        JsonNode child = node.get(field);
        if (child == null)
            throw new IllegalArgumentException(kind.tag() + " is missing '" + field + "'");
        return child;
    }

    private static List<LatticeValue> readElements(JsonNode array) {
        if (!array.isArray())
            throw new IllegalArgumentException("Expected a JSON array, got " + array.getNodeType());
        List<LatticeValue> out = new ArrayList<>(array.size());
        for (JsonNode e : array)
            out.add(read(e));
        return out;
    }

    private static Map<String, LatticeValue> readEntries(JsonNode object) {
        if (!object.isObject())
            throw new IllegalArgumentException("Expected a JSON object, got " + object.getNodeType());
        Map<String, LatticeValue> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), read(e.getValue()));
        }
        return out;
    }

    private static ObjectNode tagged(ValueKind kind) {
        ObjectNode obj = NODES.objectNode();
        obj.put(TAG, kind.tag());
        return obj;
    }

    private static ArrayNode elementsNode(List<LatticeValue> elements) {
        ArrayNode arr = NODES.arrayNode(elements.size());
        for (LatticeValue e : elements)
            arr.add(toJson(e));
        return arr;
    }

    private static ObjectNode entriesNode(Map<String, LatticeValue> entries) {
        ObjectNode obj = NODES.objectNode();
        entries.forEach((k, v) -> obj.set(k, toJson(v)));
        return obj;
    }

    /**
     * Jackson module that lets {@link LatticeValue} fields appear in POJOs and
     * records.
     */
    public static SimpleModule module() {
        SimpleModule module = new SimpleModule("LatticeJson");
        module.addSerializer(LatticeValue.class, new Serializer());
        module.addDeserializer(LatticeValue.class, new Deserializer());
        return module;
    }

    static final class Serializer extends JsonSerializer<LatticeValue> {
        @Override
        public void serialize(LatticeValue value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            gen.writeTree(toJson(value));
        }
    }

    static final class Deserializer extends JsonDeserializer<LatticeValue> {
        @Override
        public LatticeValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            try {
                return fromJson(node);
            } catch (IllegalArgumentException e) {
                return (LatticeValue) ctxt.reportInputMismatch(LatticeValue.class, "%s", e.getMessage());
            }
        }

        @Override
        public LatticeValue getNullValue(DeserializationContext ctxt) {
            return null;
        }
    }
}
