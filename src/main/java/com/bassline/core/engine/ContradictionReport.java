package com.bassline.core.engine;

import com.bassline.core.lattice.Contradiction;

/**
 * A delivery to {@code contactId} that was refused because it contradicted the
 * stored value.
 */
public record ContradictionReport(String contactId, Contradiction contradiction) {
}
