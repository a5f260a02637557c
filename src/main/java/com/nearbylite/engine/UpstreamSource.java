package com.nearbylite.engine;

/**
 * Push-based asynchronous sequence: the friend roster or the user's location.
 */
@FunctionalInterface
public interface UpstreamSource<T> {

    /**
     * Starts delivering values to {@code listener} until the returned subscription is closed.
     * Implementations must not block the caller.
     */
    Subscription subscribe(UpstreamListener<? super T> listener);
}
