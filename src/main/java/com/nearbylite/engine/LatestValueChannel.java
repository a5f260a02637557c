package com.nearbylite.engine;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot mailbox: a newer value overwrites an unconsumed older one.
 * Any thread may {@link #offer}; one consumer thread {@link #poll}s.
 */
final class LatestValueChannel<T> {

    private final AtomicReference<T> slot = new AtomicReference<>();
    private final Runnable onOffer;
    private final String name;

    LatestValueChannel(String name, Runnable onOffer) {
        this.name = name;
        this.onOffer = onOffer;
    }

    /** @return true if an unconsumed value was overwritten */
    boolean offer(T value) {
        Objects.requireNonNull(value, name);
        boolean replaced = slot.getAndSet(value) != null;
        onOffer.run();
        return replaced;
    }

    /** Takes the pending value, or null when nothing arrived since the last poll. */
    T poll() {
        return slot.getAndSet(null);
    }

    String name() {
        return name;
    }
}
