package com.nearbylite.engine;

import com.nearbylite.model.NearbyFriendResult;

import java.util.List;
import java.util.Objects;

/**
 * Everything the engine remembers between ticks. Values only flow through
 * {@link NearbyFriendsCalculator#step}; whoever holds an instance is its single writer.
 *
 * @param cache       last ranked computation
 * @param lastEmitted last snapshot pushed downstream, null before the first emission
 */
public record EngineState(ResultCache cache, List<NearbyFriendResult> lastEmitted) {

    public static EngineState initial() {
        return new EngineState(ResultCache.EMPTY, null);
    }

    public EngineState {
        Objects.requireNonNull(cache, "cache");
        lastEmitted = lastEmitted == null ? null : List.copyOf(lastEmitted);
    }

    EngineState withCache(ResultCache next) {
        return new EngineState(next, lastEmitted);
    }

    EngineState withLastEmitted(List<NearbyFriendResult> emitted) {
        return new EngineState(cache, emitted);
    }
}
