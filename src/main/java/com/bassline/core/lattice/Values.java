package com.bassline.core.lattice;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factory methods for building {@link LatticeValue}s from plain Java data.
 *
 * <pre>
 * Values.growSet("x", "y");           // GrowSet{"x", "y"}
 * Values.of(Map.of("a", 1));          // {a: 1}
 * Values.shrinkMap(Map.of("k", 2.5)); // ShrinkMap{k: 2.5}
 * </pre>
 */
public final class Values {
    private Values() {
        // Utility class
    }

    /**
     * Converts a Java object into a lattice value.
     *
     * {@code null} becomes {@link NoneValue}; numbers, strings and booleans
     * become scalars; {@link Map} becomes a {@link DictValue}; {@link Set}
     * becomes a {@link PlainSet}; other collections and arrays become
     * {@link PlainArray}s. Lattice values pass through unchanged.
     *
     * @throws IllegalArgumentException for any other type.
     */
    public static LatticeValue of(Object o) {
        if (o == null)
            return NoneValue.INSTANCE;
        if (o instanceof LatticeValue v)
            return v;
        if (o instanceof Number n)
            return new NumberValue(n.doubleValue());
        if (o instanceof CharSequence s)
            return new StringValue(s.toString());
        if (o instanceof Boolean b)
            return BoolValue.of(b);
        if (o instanceof Map<?, ?> m)
            return new DictValue(entries(m));
        if (o instanceof Set<?> s)
            return new PlainSet(new LinkedHashSet<>(list(s)));
        if (o instanceof Collection<?> c)
            return new PlainArray(list(c));
        if (o instanceof Object[] arr)
            return new PlainArray(list(Arrays.asList(arr)));
        throw new IllegalArgumentException("Cannot convert " + o.getClass().getName() + " to a lattice value");
    }

    public static NumberValue number(double value) {
        return new NumberValue(value);
    }

    public static StringValue string(String value) {
        return new StringValue(value);
    }

    public static BoolValue bool(boolean value) {
        return BoolValue.of(value);
    }

    public static GrowSet growSet(Object... elements) {
        return new GrowSet(new LinkedHashSet<>(list(Arrays.asList(elements))));
    }

    public static ShrinkSet shrinkSet(Object... elements) {
        return new ShrinkSet(new LinkedHashSet<>(list(Arrays.asList(elements))));
    }

    public static GrowArray growArray(Object... items) {
        return new GrowArray(list(Arrays.asList(items)));
    }

    public static ShrinkArray shrinkArray(Object... items) {
        return new ShrinkArray(list(Arrays.asList(items)));
    }

    public static GrowMap growMap(Map<String, ?> entries) {
        return new GrowMap(entries(entries));
    }

    public static ShrinkMap shrinkMap(Map<String, ?> entries) {
        return new ShrinkMap(entries(entries));
    }

    public static PlainArray array(Object... items) {
        return new PlainArray(list(Arrays.asList(items)));
    }

    public static PlainSet set(Object... elements) {
        return new PlainSet(new LinkedHashSet<>(list(Arrays.asList(elements))));
    }

    public static DictValue dict(Map<String, ?> entries) {
        return new DictValue(entries(entries));
    }

    /**
     * Converts a lattice value back into plain Java data: scalars to
     * {@code Double}/{@code String}/{@code Boolean}/{@code null}, keyed
     * collections to {@link Map}s, sets to {@link Set}s and arrays to
     * {@link List}s.
     */
    public static Object toJava(LatticeValue v) {
        if (v == null || v == NoneValue.INSTANCE)
            return null;
        if (v instanceof NumberValue n)
            return n.value();
        if (v instanceof StringValue s)
            return s.value();
        if (v instanceof BoolValue b)
            return b.value();
        if (v instanceof KeyedCollection k) {
            Map<String, Object> out = new LinkedHashMap<>();
            k.entries().forEach((key, val) -> out.put(key, toJava(val)));
            return out;
        }
        ElementCollection c = (ElementCollection) v;
        List<Object> items = new ArrayList<>(c.size());
        for (LatticeValue e : c.elements())
            items.add(toJava(e));
        if (v instanceof GrowArray || v instanceof ShrinkArray || v instanceof PlainArray)
            return items;
        return new LinkedHashSet<>(items);
    }

    private static List<LatticeValue> list(Collection<?> source) {
        List<LatticeValue> out = new ArrayList<>(source.size());
        for (Object o : source)
            out.add(of(o));
        return out;
    }

    private static Map<String, LatticeValue> entries(Map<?, ?> source) {
        Map<String, LatticeValue> out = new LinkedHashMap<>(source.size() * 2);
        for (Map.Entry<?, ?> e : source.entrySet())
            out.put(String.valueOf(e.getKey()), of(e.getValue()));
        return out;
    }
}
