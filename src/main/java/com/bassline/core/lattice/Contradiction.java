package com.bassline.core.lattice;

/**
 * Raised when two values cannot be joined: unequal scalars, incompatible
 * kinds, or a Shrink merge with nothing left in common.
 *
 * Recoverable. The contact being written keeps its previous value, and the
 * caller may retry with a different value or blend mode. Both operands are kept
 * for diagnostics.
 */
public class Contradiction extends RuntimeException {
    private final LatticeValue left;
    private final LatticeValue right;

    public Contradiction(String message, LatticeValue left, LatticeValue right) {
        super(message + ": " + left + " vs " + right);
        this.left = left;
        this.right = right;
    }

    public LatticeValue left() {
        return left;
    }

    public LatticeValue right() {
        return right;
    }
}
