package com.bassline.core.lattice;

/**
 * An immutable value that can live in a contact.
 *
 * Implementations are value objects: two instances are interchangeable when
 * they are {@code equals}. The merge algebra over these values lives in
 * {@link LatticeMerge}; this interface only identifies the variant.
 *
 * Variants:
 * - scalars: {@link NoneValue}, {@link BoolValue}, {@link NumberValue},
 * {@link StringValue}
 * - plain (untagged) collections: {@link DictValue}, {@link PlainArray},
 * {@link PlainSet}
 * - tagged collections: {@link GrowSet}, {@link ShrinkSet}, {@link GrowArray},
 * {@link ShrinkArray}, {@link GrowMap}, {@link ShrinkMap}
 */
public interface LatticeValue {

    ValueKind kind();
}
