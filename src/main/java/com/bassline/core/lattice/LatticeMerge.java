package com.bassline.core.lattice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The merge (join) operation over {@link LatticeValue}s.
 *
 * Rules, applied in order:
 * 1. Absent operand ({@code null} or {@link NoneValue}): the other operand wins.
 * 2. Structurally equal operands: the left operand is returned unchanged.
 * 3. Same tagged kind: Grow kinds take the union, Shrink kinds the
 * intersection. Map values under shared keys merge recursively. An empty
 * Shrink result is a {@link Contradiction}.
 * 4. Tagged vs. untagged collection of a compatible shape: the untagged side is
 * coerced into the tagged kind, then rule 3 applies.
 * 5. Two untagged collections of the same shape: legacy grow. Sets take the
 * union, dicts merge key-wise, arrays concatenate. The collection level never
 * contradicts here; nested dict values still can.
 * 6. Anything else is a {@link Contradiction}.
 *
 * Rules 1-4 are commutative, idempotent and associative. Rule 5 array
 * concatenation is neither commutative nor idempotent.
 */
public final class LatticeMerge {
    private LatticeMerge() {
        // Utility class
    }

    public static boolean isAbsent(LatticeValue v) {
        return v == null || v == NoneValue.INSTANCE;
    }

    /**
     * Joins two values.
     *
     * @param a Current value, may be {@code null} (unset).
     * @param b Incoming value, may be {@code null}.
     * @return The merged value. Returns {@code a} itself when nothing changes.
     * @throws Contradiction if the values cannot be joined.
     */
    public static LatticeValue merge(LatticeValue a, LatticeValue b) {
        if (isAbsent(a))
            return b == null ? a : b;
        if (isAbsent(b))
            return a;
        if (a.equals(b))
            return a;

        boolean taggedA = a instanceof TaggedCollection;
        boolean taggedB = b instanceof TaggedCollection;
        if (taggedA && taggedB) {
            if (a.kind() != b.kind())
                throw new Contradiction("Cannot merge " + a.kind().tag() + " with " + b.kind().tag(), a, b);
            return mergeSameKind(a, b);
        }
        if (taggedA)
            return mergeSameKind(a, coerce(a.kind(), b, a));
        if (taggedB)
            return mergeSameKind(coerce(b.kind(), a, b), b);

        return mergePlain(a, b);
    }

    /**
     * Tests whether delivering {@code incoming} to a contact holding
     * {@code current} under merge semantics would change it.
     */
    public static boolean wouldChange(LatticeValue current, LatticeValue incoming) {
        return !Objects.equals(merge(current, incoming), current);
    }

    // ── Same-kind merges ─────────────────────────────────────────────

    private static LatticeValue mergeSameKind(LatticeValue a, LatticeValue b) {
        switch (a.kind()) {
            case GROW_SET: {
                Set<LatticeValue> union = new LinkedHashSet<>(((GrowSet) a).values());
                union.addAll(((GrowSet) b).values());
                return new GrowSet(union);
            }
            case SHRINK_SET: {
                Set<LatticeValue> common = new LinkedHashSet<>(((ShrinkSet) a).values());
                common.retainAll(((ShrinkSet) b).values());
                if (common.isEmpty())
                    throw new Contradiction("ShrinkSet intersection is empty", a, b);
                return new ShrinkSet(common);
            }
            case GROW_ARRAY:
                return new GrowArray(multisetJoin(((GrowArray) a).items(), ((GrowArray) b).items()));
            case SHRINK_ARRAY: {
                List<LatticeValue> common = multisetMeet(((ShrinkArray) a).items(), ((ShrinkArray) b).items());
                if (common.isEmpty())
                    throw new Contradiction("ShrinkArray intersection is empty", a, b);
                return new ShrinkArray(common);
            }
            case GROW_MAP:
                return new GrowMap(unionEntries(((GrowMap) a).entries(), ((GrowMap) b).entries()));
            case SHRINK_MAP: {
                Map<String, LatticeValue> common = intersectEntries(((ShrinkMap) a).entries(),
                        ((ShrinkMap) b).entries());
                if (common.isEmpty())
                    throw new Contradiction("ShrinkMap has no keys in common", a, b);
                return new ShrinkMap(common);
            }
            default:
                throw new IllegalStateException("Not a tagged collection: " + a.kind());
        }
    }

    /**
     * Converts an untagged value into the given tagged kind.
     *
     * @param other The tagged operand, only used for the error message.
     */
    private static LatticeValue coerce(ValueKind target, LatticeValue untagged, LatticeValue other) {
        switch (target) {
            case GROW_SET:
            case SHRINK_SET:
            case GROW_ARRAY:
            case SHRINK_ARRAY:
                if (untagged instanceof PlainSet || untagged instanceof PlainArray) {
                    List<LatticeValue> elements = ((ElementCollection) untagged).elements();
                    return switch (target) {
                        case GROW_SET -> new GrowSet(new LinkedHashSet<>(elements));
                        case SHRINK_SET -> new ShrinkSet(new LinkedHashSet<>(elements));
                        case GROW_ARRAY -> new GrowArray(elements);
                        default -> new ShrinkArray(elements);
                    };
                }
                break;
            case GROW_MAP:
                if (untagged instanceof DictValue d)
                    return new GrowMap(d.entries());
                break;
            case SHRINK_MAP:
                if (untagged instanceof DictValue d)
                    return new ShrinkMap(d.entries());
                break;
            default:
                break;
        }
        throw new Contradiction("Cannot merge " + target.tag() + " with " + untagged.kind().tag(), other, untagged);
    }

    // ── Legacy (untagged) merges ─────────────────────────────────────

    private static LatticeValue mergePlain(LatticeValue a, LatticeValue b) {
        if (a instanceof PlainSet x && b instanceof PlainSet y) {
            Set<LatticeValue> union = new LinkedHashSet<>(x.values());
            union.addAll(y.values());
            return new PlainSet(union);
        }
        if (a instanceof DictValue x && b instanceof DictValue y) {
            return new DictValue(unionEntries(x.entries(), y.entries()));
        }
        if (a instanceof PlainArray x && b instanceof PlainArray y) {
            List<LatticeValue> concat = new ArrayList<>(x.items().size() + y.items().size());
            concat.addAll(x.items());
            concat.addAll(y.items());
            return new PlainArray(concat);
        }
        if (a.kind() == b.kind())
            throw new Contradiction("Conflicting values", a, b);
        throw new Contradiction("Cannot merge " + a.kind().tag() + " with " + b.kind().tag(), a, b);
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private static Map<String, LatticeValue> unionEntries(Map<String, LatticeValue> a, Map<String, LatticeValue> b) {
        Map<String, LatticeValue> out = new LinkedHashMap<>(a);
        for (Map.Entry<String, LatticeValue> e : b.entrySet()) {
            LatticeValue mine = out.get(e.getKey());
            out.put(e.getKey(), mine == null ? e.getValue() : merge(mine, e.getValue()));
        }
        return out;
    }

    private static Map<String, LatticeValue> intersectEntries(Map<String, LatticeValue> a,
            Map<String, LatticeValue> b) {
        Map<String, LatticeValue> out = new LinkedHashMap<>();
        for (Map.Entry<String, LatticeValue> e : a.entrySet()) {
            LatticeValue theirs = b.get(e.getKey());
            if (theirs != null)
                out.put(e.getKey(), merge(e.getValue(), theirs));
        }
        return out;
    }

    private static List<LatticeValue> multisetJoin(List<LatticeValue> a, List<LatticeValue> b) {
        Map<LatticeValue, Integer> ca = Elements.counts(a);
        Map<LatticeValue, Integer> cb = Elements.counts(b);
        Map<LatticeValue, Integer> joined = new LinkedHashMap<>(ca);
        cb.forEach((v, n) -> joined.merge(v, n, Math::max));
        return expand(joined);
    }

    private static List<LatticeValue> multisetMeet(List<LatticeValue> a, List<LatticeValue> b) {
        Map<LatticeValue, Integer> ca = Elements.counts(a);
        Map<LatticeValue, Integer> cb = Elements.counts(b);
        Map<LatticeValue, Integer> met = new LinkedHashMap<>();
        ca.forEach((v, n) -> {
            Integer m = cb.get(v);
            if (m != null)
                met.put(v, Math.min(n, m));
        });
        return expand(met);
    }

    private static List<LatticeValue> expand(Map<LatticeValue, Integer> counts) {
        List<LatticeValue> out = new ArrayList<>();
        counts.forEach((v, n) -> {
            for (int i = 0; i < n; i++)
                out.add(v);
        });
        return out;
    }
}
