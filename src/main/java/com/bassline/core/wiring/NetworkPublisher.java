package com.bassline.core.wiring;

import com.bassline.core.PropagationNetwork;
import com.bassline.core.engine.NonConvergenceException;
import com.bassline.core.engine.PropagationResult;
import com.bassline.core.lattice.Contradiction;
import com.bassline.core.util.ErrorRateLimiter;
import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that consumes {@link ContactUpdateEvent}s and drives
 * propagation.
 *
 * This is the single writer of its network: it runs on the Disruptor's
 * consumer thread, while any number of producer threads publish writes into
 * the ring buffer.
 *
 * Batching: writes are staged as they arrive and a single
 * {@code propagate()} runs when the Disruptor signals end of batch (or an
 * event asks for it). A burst of writes therefore costs one pass.
 *
 * A write that is rejected (unknown contact, contradiction) is logged,
 * throttled, and dropped; the consumer thread keeps running.
 */
public final class NetworkPublisher implements EventHandler<ContactUpdateEvent> {
    private static final Logger log = LogManager.getLogger(NetworkPublisher.class);

    private final PropagationNetwork network;
    private final ErrorRateLimiter limiter = new ErrorRateLimiter(log, 1000);

    private PostPropagationCallback postPropagate;
    // Written by the consumer thread only.
    private volatile long accepted, rejected, passes;

    public NetworkPublisher(PropagationNetwork network) {
        this.network = network;
    }

    /**
     * Sets a callback invoked after every propagation pass on the consumer
     * thread.
     */
    public void setPostPropagationCallback(PostPropagationCallback cb) {
        this.postPropagate = cb;
    }

    /**
     * Processes a single event from the ring buffer.
     *
     * @param event      The event carried by the ring buffer.
     * @param sequence   The sequence id of the event.
     * @param endOfBatch True if this is the last event currently available.
     */
    @Override
    public void onEvent(ContactUpdateEvent event, long sequence, boolean endOfBatch) {
        boolean forcePass = event.isBatchEnd();
        if (!event.isFlush()) {
            try {
                network.stageUpdate(event.contactId(), event.value());
                accepted++;
            } catch (Contradiction | IllegalArgumentException e) {
                rejected++;
                limiter.log("Dropped write to " + event.contactId() + " (seq " + sequence + "): " + e.getMessage(),
                        null);
            }
        }
        event.clear();

        if (forcePass || endOfBatch)
            runPass();
    }

    private void runPass() {
        PropagationResult result;
        try {
            result = network.propagate();
        } catch (NonConvergenceException e) {
            limiter.log("Propagation aborted: " + e.getMessage(), e);
            return;
        }
        passes++;
        if (postPropagate != null)
            postPropagate.onPropagated(result);
    }

    public long acceptedCount() {
        return accepted;
    }

    public long rejectedCount() {
        return rejected;
    }

    public long passCount() {
        return passes;
    }

    /**
     * Callback for post-propagation actions.
     */
    @FunctionalInterface
    public interface PostPropagationCallback {
        /**
         * Called after the network has converged.
         *
         * @param result What the pass changed.
         */
        void onPropagated(PropagationResult result);
    }
}
