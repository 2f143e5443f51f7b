package com.bassline.core.util;

import com.bassline.core.api.PropagationListener;
import com.bassline.core.lattice.Contradiction;
import com.bassline.core.lattice.LatticeValue;

/**
 * Tracks per-pass latency and counts of updates, contradictions and gadget
 * faults.
 */
public final class PropagationStatsListener implements PropagationListener {
    private long passStartNanos, lastLatencyNanos;
    private long totalPasses, totalLatencyNanos, totalSteps;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private long contactUpdates, contradictions, gadgetFaults;
    private int lastSteps;

    @Override
    public void onPropagationStart(long epoch) {
        passStartNanos = System.nanoTime();
    }

    @Override
    public void onContactUpdated(long epoch, String contactId, LatticeValue value) {
        contactUpdates++;
    }

    @Override
    public void onContradiction(long epoch, String contactId, Contradiction contradiction) {
        contradictions++;
    }

    @Override
    public void onGadgetFault(long epoch, String groupId, String gadgetId, Throwable error) {
        gadgetFaults++;
    }

    @Override
    public void onPropagationEnd(long epoch, int steps) {
        lastLatencyNanos = System.nanoTime() - passStartNanos;
        lastSteps = steps;
        totalSteps += steps;
        totalPasses++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public int lastSteps() {
        return lastSteps;
    }

    public long totalPasses() {
        return totalPasses;
    }

    public long totalSteps() {
        return totalSteps;
    }

    public long contactUpdates() {
        return contactUpdates;
    }

    public long contradictions() {
        return contradictions;
    }

    public long gadgetFaults() {
        return gadgetFaults;
    }

    public double avgLatencyMicros() {
        return totalPasses > 0 ? (double) totalLatencyNanos / totalPasses / 1000.0 : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalPasses = 0;
        totalLatencyNanos = 0;
        totalSteps = 0;
        contactUpdates = 0;
        contradictions = 0;
        gadgetFaults = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-14s | %10s | %10s | %10s | %10s\n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("--------------------------------------------------------------------\n");
        sb.append(String.format("%-14s | %10d | %10.2f | %10.2f | %10.2f\n", "Passes", totalPasses,
                avgLatencyMicros(), minLatencyNanos() / 1000.0, maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-14s | %10d\n", "Steps", totalSteps));
        sb.append(String.format("%-14s | %10d\n", "Updates", contactUpdates));
        sb.append(String.format("%-14s | %10d\n", "Contradictions", contradictions));
        sb.append(String.format("%-14s | %10d\n", "Gadget faults", gadgetFaults));
        return sb.toString();
    }
}
