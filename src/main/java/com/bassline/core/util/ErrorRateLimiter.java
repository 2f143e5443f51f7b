package com.bassline.core.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging, so that a gadget failing on every pass or
 * a producer flooding bad writes does not flood the log.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong(0);

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs at error level unless another message was logged within the
     * interval.
     *
     * @return {@code true} if the message was written.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // The first call always logs.
        if (last == 0 || now - last > minIntervalNanos) {
            // Only one thread logs per interval.
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                if (dropped > 0)
                    logger.error("{} (throttled, {} suppressed)", message, dropped, t);
                else
                    logger.error(message, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
