package com.bassline.core.wiring;

import com.bassline.core.lattice.LatticeValue;
import com.lmax.disruptor.RingBuffer;

/**
 * A mutable carrier for contact writes, used within the LMAX Disruptor
 * RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * the lifetime of the network. Producers fill one in with {@link #set}; the
 * consumer reads it and calls {@link #clear()} so the ring does not keep
 * values alive.
 *
 * An event with no contact id is a flush: it writes nothing and only asks for
 * a propagation pass.
 */
public final class ContactUpdateEvent {
    private String contactId;
    private LatticeValue value;
    private boolean batchEnd;
    private long sequenceId;

    /**
     * Configures the event for a contact write.
     *
     * @param contactId Target contact.
     * @param value     Value to write with the contact's blend mode.
     * @param batchEnd  If true, forces a propagation pass after this event.
     * @param seqId     Producer-side sequence id, for correlation in logs.
     */
    public void set(String contactId, LatticeValue value, boolean batchEnd, long seqId) {
        this.contactId = contactId;
        this.value = value;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    /** Configures the event as a flush. */
    public void setFlush(long seqId) {
        set(null, null, true, seqId);
    }

    public String contactId() {
        return contactId;
    }

    public LatticeValue value() {
        return value;
    }

    public boolean isFlush() {
        return contactId == null;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        contactId = null;
        value = null;
        batchEnd = false;
        sequenceId = 0;
    }

    /**
     * Claims a slot, fills it and publishes it.
     *
     * @return The ring sequence used.
     */
    public static long publish(RingBuffer<ContactUpdateEvent> ringBuffer, String contactId, LatticeValue value,
            boolean batchEnd) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(contactId, value, batchEnd, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
        return sequence;
    }

    /** Publishes a flush. */
    public static long publishFlush(RingBuffer<ContactUpdateEvent> ringBuffer) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setFlush(sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
        return sequence;
    }
}
