package com.nearbylite.engine;

import com.nearbylite.model.NearbyFriendResult;
import com.nearbylite.model.UserLocationSample;

import java.util.List;

/**
 * Last ranked result and the inputs it was computed from.
 * <p>
 * {@code results} is sorted by (rankScore, distance, id), holds only entries within the
 * geo-filter radius and never more than {@code maxTrackedFriends} of them.
 * {@code userSample} is null until the first ranked computation.
 */
public record ResultCache(
    List<NearbyFriendResult> results,
    UserLocationSample userSample,
    long rosterFingerprint,
    long recalculatedAtMillis
) {
    public static final ResultCache EMPTY = new ResultCache(List.of(), null, RosterFingerprint.NONE, 0L);

    public ResultCache {
        results = List.copyOf(results);
    }

    public boolean isRanked() {
        return userSample != null;
    }
}
