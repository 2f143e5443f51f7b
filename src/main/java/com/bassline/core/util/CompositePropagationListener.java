package com.bassline.core.util;

import com.bassline.core.api.PropagationListener;
import com.bassline.core.lattice.Contradiction;
import com.bassline.core.lattice.LatticeValue;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link PropagationListener}s, in the order they
 * were added.
 */
public class CompositePropagationListener implements PropagationListener {
    private PropagationListener[] listeners = new PropagationListener[0];

    public CompositePropagationListener(PropagationListener... initial) {
        for (PropagationListener l : initial)
            add(l);
    }

    public CompositePropagationListener add(PropagationListener listener) {
        PropagationListener[] old = listeners;
        PropagationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPropagationStart(long epoch) {
        for (PropagationListener l : listeners)
            l.onPropagationStart(epoch);
    }

    @Override
    public void onContactUpdated(long epoch, String contactId, LatticeValue value) {
        for (PropagationListener l : listeners)
            l.onContactUpdated(epoch, contactId, value);
    }

    @Override
    public void onContradiction(long epoch, String contactId, Contradiction contradiction) {
        for (PropagationListener l : listeners)
            l.onContradiction(epoch, contactId, contradiction);
    }

    @Override
    public void onGadgetFault(long epoch, String groupId, String gadgetId, Throwable error) {
        for (PropagationListener l : listeners)
            l.onGadgetFault(epoch, groupId, gadgetId, error);
    }

    @Override
    public void onPropagationEnd(long epoch, int steps) {
        for (PropagationListener l : listeners)
            l.onPropagationEnd(epoch, steps);
    }
}
