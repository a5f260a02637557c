package com.nearbylite.engine;

import com.nearbylite.model.NearbyFriendResult;

import java.util.List;

/**
 * Outcome of one tick.
 *
 * @param state          state to carry into the next tick
 * @param snapshot       the snapshot served for this tick, emitted or not
 * @param emit           whether {@code snapshot} should be pushed downstream
 * @param reason         why the tick recomputed, {@link RecalculationReason#NONE} when it reused the cache
 * @param malformedCount roster entries dropped for a bad coordinate
 */
public record StepResult(
    EngineState state,
    List<NearbyFriendResult> snapshot,
    boolean emit,
    RecalculationReason reason,
    int malformedCount
) {
    public boolean recomputed() {
        return reason.recompute();
    }
}
