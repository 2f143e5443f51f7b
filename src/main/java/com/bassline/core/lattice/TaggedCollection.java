package com.bassline.core.lattice;

/**
 * A collection carrying an explicit Grow or Shrink semantic.
 *
 * Grow collections only ever gain members under merge (join); Shrink
 * collections only ever lose members (meet) and fail with a
 * {@link Contradiction} when nothing is left.
 */
public interface TaggedCollection extends LatticeValue {

    boolean isGrowing();
}
