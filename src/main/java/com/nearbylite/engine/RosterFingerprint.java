package com.nearbylite.engine;

import com.nearbylite.model.FriendSnapshot;

import java.util.List;

/**
 * Cheap structural hash of a roster. Order-independent: two rosters with the same
 * entries in a different order share a fingerprint; any field change of any entry
 * (or a membership change) almost surely changes it.
 */
public final class RosterFingerprint {

    /** Fingerprint of "no roster seen yet". */
    public static final long NONE = 0L;

    public static long of(List<FriendSnapshot> roster) {
        long acc = 0x9E3779B97F4A7C15L;
        for (var friend : roster) {
            // addition is commutative, so entry order does not matter
            acc += mix(entryHash(friend));
        }
        long fp = mix(acc ^ roster.size());
        return fp == NONE ? 1L : fp;
    }

    static long entryHash(FriendSnapshot f) {
        long h = f.id().hashCode();
        h = 31 * h + f.displayName().hashCode();
        h = 31 * h + (f.avatarUrl() == null ? 0 : f.avatarUrl().hashCode());
        if (f.coordinate() != null) {
            h = 31 * h + Double.doubleToLongBits(f.coordinate().latitude());
            h = 31 * h + Double.doubleToLongBits(f.coordinate().longitude());
        } else {
            h = 31 * h + 0x5DEECE66DL;
        }
        h = 31 * h + (f.isOnline() ? 1231 : 1237);
        h = 31 * h + f.lastActiveAtMillis();
        return h;
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    private RosterFingerprint() {}
}
