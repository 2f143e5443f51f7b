package com.bassline.core.engine;

import com.bassline.core.api.PropagationListener;
import com.bassline.core.gadget.GadgetSpec;
import com.bassline.core.lattice.Contradiction;
import com.bassline.core.lattice.LatticeValue;
import com.bassline.core.model.Contact;
import com.bassline.core.model.Wire;
import com.bassline.core.util.ErrorRateLimiter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives dirty contacts through wires and gadgets until nothing changes.
 *
 * Algorithm:
 *
 * 1. Mark Dirty: a write that changes a contact adds its id to an
 * insertion-ordered dirty set. Re-marking an already queued contact is a
 * no-op.
 *
 * 2. Drain: pop the oldest dirty contact and deliver its value along every
 * wire that carries values away from it. A delivery is written with the
 * target's blend mode and the target is queued only if its value changed, so
 * cycles stop as soon as every contact on them is stable.
 *
 * 3. Gadgets: popping a gadget input port queues its gadget. Gadgets run only
 * once the contact queue is empty, so a gadget sees all the input changes of
 * the current wave and fires once for them. Its outputs are published
 * together after its future completes, which may queue more contacts.
 *
 * 4. Budget: every contact pop is one step. Exceeding
 * {@link SchedulerConfig#getMaxSteps()} aborts the pass with
 * {@link NonConvergenceException}.
 *
 * Rollback: every contact is journaled with its value before the first write
 * since the last completed pass, including direct writes staged through
 * {@link #write}. An aborted pass restores the journal so that no partial
 * state survives.
 *
 * Contradictions hit by deliveries are recorded and the rest of the queue
 * keeps draining. Gadget failures are recorded as {@link GadgetFault}s and
 * that invocation publishes nothing.
 *
 * Single-threaded and not re-entrant.
 */
public final class PropagationScheduler {
    private static final Logger log = LogManager.getLogger(PropagationScheduler.class);

    private final GroupArena arena;
    private final SchedulerConfig config;
    private final ErrorRateLimiter faultLimiter = new ErrorRateLimiter(log, 1000);

    private final LinkedHashSet<String> dirty = new LinkedHashSet<>();
    private final LinkedHashSet<String> pendingGadgets = new LinkedHashSet<>();

    // Contact id -> value before the first write since the last completed pass.
    // A null value means the contact was unset.
    private final Map<String, LatticeValue> journal = new LinkedHashMap<>();

    // Primitive group id -> inputs of the last successful pure invocation.
    private final Map<String, Map<String, LatticeValue>> memo = new HashMap<>();

    private PropagationListener listener;
    private boolean running;
    private long epoch;

    // Per-pass accumulators
    private List<ContradictionReport> contradictions;
    private List<GadgetFault> faults;

    public PropagationScheduler(GroupArena arena, SchedulerConfig config) {
        this.arena = Objects.requireNonNull(arena, "arena");
        this.config = config != null ? config : SchedulerConfig.defaults();
        if (this.config.getMaxSteps() <= 0)
            throw new IllegalArgumentException("maxSteps must be positive: " + this.config.getMaxSteps());
        if (this.config.getGadgetTimeoutMillis() <= 0)
            throw new IllegalArgumentException(
                    "gadgetTimeoutMillis must be positive: " + this.config.getGadgetTimeoutMillis());
    }

    public void setListener(PropagationListener listener) {
        this.listener = listener;
    }

    public SchedulerConfig config() {
        return config;
    }

    public long epoch() {
        return epoch;
    }

    public boolean isRunning() {
        return running;
    }

    /** True if a pass would have work to do. */
    public boolean hasPendingWork() {
        return !dirty.isEmpty() || !pendingGadgets.isEmpty();
    }

    /**
     * Queues a contact for delivery in the next pass.
     */
    public void markDirty(String contactId) {
        dirty.add(contactId);
    }

    /**
     * Applies a direct write to a contact and queues it if it changed. The
     * previous value is journaled so that an aborted pass can restore it.
     *
     * @return {@code true} if the stored value changed.
     * @throws Contradiction if the write contradicts the stored value, which is
     *                       then left untouched.
     */
    public boolean write(String contactId, LatticeValue value) {
        Contact c = arena.contact(contactId);
        LatticeValue before = c.content();
        if (!c.write(value))
            return false;
        journal(contactId, before);
        dirty.add(contactId);
        return true;
    }

    /** Drops all scheduling state for a contact that is being removed. */
    public void forgetContact(String contactId) {
        dirty.remove(contactId);
        journal.remove(contactId);
    }

    /** Drops all scheduling state for a primitive group that is being removed. */
    public void forgetGroup(String groupId) {
        pendingGadgets.remove(groupId);
        memo.remove(groupId);
    }

    /** Clears queues, journal and memo. Used when the arena is replaced. */
    public void reset() {
        if (running)
            throw new IllegalStateException("Cannot reset while propagating");
        dirty.clear();
        pendingGadgets.clear();
        journal.clear();
        memo.clear();
    }

    /**
     * Runs one pass to the fixpoint.
     *
     * @return What changed, plus any contradictions and gadget faults.
     * @throws IllegalStateException   if called while a pass is already running.
     * @throws NonConvergenceException if the step budget is exceeded; the pass
     *                                 is rolled back.
     */
    public PropagationResult propagate() {
        if (running)
            throw new IllegalStateException("propagate() is not re-entrant");
        running = true;
        epoch++;
        contradictions = new ArrayList<>();
        faults = new ArrayList<>();

        final PropagationListener l = this.listener;
        final int maxSteps = config.getMaxSteps();
        int steps = 0;
        int invocations = 0;

        try {
            if (l != null)
                l.onPropagationStart(epoch);

            while (!dirty.isEmpty() || !pendingGadgets.isEmpty()) {
                if (!dirty.isEmpty()) {
                    String contactId = poll(dirty);
                    if (++steps > maxSteps)
                        throw new NonConvergenceException(epoch, maxSteps);
                    drain(contactId);
                } else if (runGadget(poll(pendingGadgets))) {
                    invocations++;
                }
            }

            List<String> changed = new ArrayList<>();
            for (Map.Entry<String, LatticeValue> e : journal.entrySet()) {
                Contact c = arena.findContact(e.getKey());
                if (c != null && !Objects.equals(c.content(), e.getValue()))
                    changed.add(e.getKey());
            }
            journal.clear();

            if (l != null)
                l.onPropagationEnd(epoch, steps);

            PropagationResult result = new PropagationResult(epoch, steps, invocations, changed, contradictions,
                    faults);
            log.debug("Pass {} converged: steps={}, gadgets={}, changed={}, contradictions={}, faults={}", epoch,
                    steps, invocations, changed.size(), contradictions.size(), faults.size());
            return result;
        } catch (RuntimeException e) {
            rollback();
            if (e instanceof NonConvergenceException)
                log.error("Pass {} aborted after {} steps; rolled back", epoch, maxSteps);
            throw e;
        } finally {
            contradictions = null;
            faults = null;
            running = false;
        }
    }

    private void drain(String contactId) {
        Contact source = arena.findContact(contactId);
        if (source == null || !source.isSet())
            return;
        LatticeValue value = source.content();
        for (Wire w : arena.wiresTouching(contactId)) {
            String target = w.targetFor(contactId);
            if (target != null)
                deliver(target, value);
        }
        GadgetBinding gadget = arena.gadgetForInput(contactId);
        if (gadget != null)
            pendingGadgets.add(gadget.groupId());
    }

    private void deliver(String targetId, LatticeValue value) {
        Contact target = arena.findContact(targetId);
        if (target == null)
            return;
        LatticeValue before = target.content();
        try {
            if (!target.write(value))
                return;
        } catch (Contradiction c) {
            contradictions.add(new ContradictionReport(targetId, c));
            log.warn("Contradiction at {}: {}", targetId, c.getMessage());
            if (listener != null)
                listener.onContradiction(epoch, targetId, c);
            return;
        }
        journal(targetId, before);
        dirty.add(targetId);
        if (listener != null)
            listener.onContactUpdated(epoch, targetId, target.content());
    }

    /**
     * @return {@code true} if the gadget body was invoked.
     */
    private boolean runGadget(String groupId) {
        GadgetBinding binding = arena.gadget(groupId);
        if (binding == null)
            return false;
        GadgetSpec spec = binding.spec();

        Map<String, LatticeValue> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, String> port : binding.inputPorts().entrySet()) {
            Contact c = arena.findContact(port.getValue());
            if (c != null && c.isSet())
                inputs.put(port.getKey(), c.content());
        }
        if (!spec.activation().isReady(inputs.keySet()))
            return false;

        boolean memoize = spec.pure() && config.isMemoizePureGadgets();
        if (memoize && inputs.equals(memo.get(groupId)))
            return false;

        Map<String, LatticeValue> outputs;
        try {
            outputs = await(spec.body().apply(Collections.unmodifiableMap(inputs)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fault(binding, e);
            return true;
        } catch (ExecutionException e) {
            fault(binding, e.getCause() != null ? e.getCause() : e);
            return true;
        } catch (TimeoutException e) {
            fault(binding, e);
            return true;
        } catch (RuntimeException e) {
            fault(binding, e);
            return true;
        }

        if (memoize)
            memo.put(groupId, inputs);
        if (outputs == null)
            return true;

        for (Map.Entry<String, LatticeValue> out : outputs.entrySet()) {
            String contactId = binding.outputPorts().get(out.getKey());
            if (contactId == null) {
                log.warn("Gadget '{}' in {} wrote undeclared port '{}'", spec.id(), groupId, out.getKey());
                continue;
            }
            if (out.getValue() != null)
                deliver(contactId, out.getValue());
        }
        return true;
    }

    private Map<String, LatticeValue> await(CompletableFuture<Map<String, LatticeValue>> future)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (future == null)
            throw new IllegalStateException("Gadget body returned no future");
        try {
            return future.get(config.getGadgetTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Gadget did not complete within " + config.getGadgetTimeoutMillis() + "ms");
        }
    }

    private void fault(GadgetBinding binding, Throwable error) {
        faults.add(new GadgetFault(binding.groupId(), binding.spec().id(), error));
        faultLimiter.log("Gadget '" + binding.spec().id() + "' in " + binding.groupId() + " failed: "
                + error.getMessage(), error);
        if (listener != null)
            listener.onGadgetFault(epoch, binding.groupId(), binding.spec().id(), error);
    }

    private void journal(String contactId, LatticeValue before) {
        if (!journal.containsKey(contactId))
            journal.put(contactId, before);
    }

    private void rollback() {
        for (Map.Entry<String, LatticeValue> e : journal.entrySet()) {
            Contact c = arena.findContact(e.getKey());
            if (c != null)
                c.reset(e.getValue());
        }
        journal.clear();
        dirty.clear();
        pendingGadgets.clear();
        memo.clear();
    }

    private static String poll(LinkedHashSet<String> queue) {
        Iterator<String> it = queue.iterator();
        String next = it.next();
        it.remove();
        return next;
    }
}
