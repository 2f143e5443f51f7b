package com.bassline.core.engine;

import java.util.List;

/**
 * Outcome of one converged propagation pass.
 *
 * @param steps             Contact pops performed.
 * @param gadgetInvocations Gadget bodies actually run (memoized skips excluded).
 * @param changedContactIds Contacts whose value at the end of the pass differs
 *                          from before it, in first-touched order.
 */
public record PropagationResult(long epoch, int steps, int gadgetInvocations, List<String> changedContactIds,
        List<ContradictionReport> contradictions, List<GadgetFault> faults) {

    public PropagationResult {
        changedContactIds = List.copyOf(changedContactIds);
        contradictions = List.copyOf(contradictions);
        faults = List.copyOf(faults);
    }

    public boolean hasContradictions() {
        return !contradictions.isEmpty();
    }

    public boolean hasFaults() {
        return !faults.isEmpty();
    }

    public boolean isClean() {
        return contradictions.isEmpty() && faults.isEmpty();
    }

    public boolean changed(String contactId) {
        return changedContactIds.contains(contactId);
    }
}
