package com.bassline.core.api;

/**
 * Handle returned by {@code subscribe}. Closing it stops delivery; closing
 * twice is harmless.
 */
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
