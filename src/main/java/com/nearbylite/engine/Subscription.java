package com.nearbylite.engine;

/**
 * Handle to a running subscription. Closing is idempotent and never throws.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
