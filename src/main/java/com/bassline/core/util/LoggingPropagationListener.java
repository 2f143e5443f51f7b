package com.bassline.core.util;

import com.bassline.core.api.PropagationListener;
import com.bassline.core.lattice.Contradiction;
import com.bassline.core.lattice.LatticeValue;

import lombok.extern.log4j.Log4j2;

/**
 * Traces every callback to the log. Contact updates go to {@code trace}, the
 * pass boundaries to {@code debug}.
 */
@Log4j2
public final class LoggingPropagationListener implements PropagationListener {
    private final ErrorRateLimiter faultLimiter = new ErrorRateLimiter(log, 1000);

    @Override
    public void onPropagationStart(long epoch) {
        log.debug("[{}] propagation start", epoch);
    }

    @Override
    public void onContactUpdated(long epoch, String contactId, LatticeValue value) {
        log.trace("[{}] {} <- {}", epoch, contactId, value);
    }

    @Override
    public void onContradiction(long epoch, String contactId, Contradiction contradiction) {
        log.warn("[{}] contradiction at {}: {}", epoch, contactId, contradiction.getMessage());
    }

    @Override
    public void onGadgetFault(long epoch, String groupId, String gadgetId, Throwable error) {
        faultLimiter.log(String.format("[%d] gadget '%s' in %s failed: %s", epoch, gadgetId, groupId,
                error.getMessage()), null);
    }

    @Override
    public void onPropagationEnd(long epoch, int steps) {
        log.debug("[{}] propagation end, {} steps", epoch, steps);
    }
}
