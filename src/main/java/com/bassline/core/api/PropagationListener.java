package com.bassline.core.api;

import com.bassline.core.lattice.Contradiction;
import com.bassline.core.lattice.LatticeValue;

/**
 * Observability interface for monitoring propagation passes.
 *
 * Implementations are registered on the network and receive callbacks during
 * every {@code propagate()} call. Typical uses:
 *
 * - Tracing which contacts change in a pass.
 * - Counting contradictions and gadget faults.
 * - Measuring pass latency (end time - start time).
 *
 * Callbacks run on the propagating thread, inside the pass. They must not call
 * back into the network.
 */
public interface PropagationListener {

    /**
     * Called immediately before a pass begins draining.
     *
     * @param epoch The incrementing pass number of the network.
     */
    void onPropagationStart(long epoch);

    /**
     * Called each time a wire delivery or gadget output changes a contact.
     *
     * @param epoch     Current pass number.
     * @param contactId The contact that changed.
     * @param value     Its new value.
     */
    void onContactUpdated(long epoch, String contactId, LatticeValue value);

    /**
     * Called when a delivery would have driven a contact into contradiction.
     * The contact kept its previous value.
     */
    void onContradiction(long epoch, String contactId, Contradiction contradiction);

    /**
     * Called when a gadget body throws, fails its future or times out. Its
     * outputs for that invocation are discarded.
     *
     * @param groupId  The primitive group hosting the gadget.
     * @param gadgetId The registry id of the gadget.
     */
    void onGadgetFault(long epoch, String groupId, String gadgetId, Throwable error);

    /**
     * Called when the pass reaches its fixpoint.
     *
     * @param steps Number of contact pops performed in this pass.
     */
    void onPropagationEnd(long epoch, int steps);
}
