package com.nearbylite.engine;

import com.nearbylite.geo.DistanceCalculator;
import com.nearbylite.model.Coordinate;
import com.nearbylite.model.FriendSnapshot;
import com.nearbylite.model.UserLocationSample;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

final class Fixtures {

    static final long T0 = 1_700_000_000_000L;

    /** Degrees of latitude spanning {@code meters} along a meridian. */
    static double metersToLatDegrees(double meters) {
        return Math.toDegrees(meters / DistanceCalculator.EARTH_RADIUS_METERS);
    }

    static UserLocationSample userAt(double lat, double lon, long at) {
        return UserLocationSample.of(lat, lon, at);
    }

    static FriendSnapshot friendMetersNorth(String id, double meters, long lastActive) {
        return FriendSnapshot.of(id, "Friend " + id, Coordinate.of(metersToLatDegrees(meters), 0.0), true, lastActive);
    }

    static List<FriendSnapshot> rosterOf(int count, double metersNorth) {
        var roster = new ArrayList<FriendSnapshot>(count);
        for (int i = 0; i < count; i++) {
            roster.add(friendMetersNorth(String.format("f-%05d", i), metersNorth + i * 0.5, T0));
        }
        return roster;
    }

    /** Clock the test moves by hand. */
    static final class MutableClock extends Clock {
        private final AtomicLong millis;
        private final AtomicBoolean failNextRead = new AtomicBoolean();

        MutableClock(long startMillis) {
            this.millis = new AtomicLong(startMillis);
        }

        void advance(long deltaMillis) {
            millis.addAndGet(deltaMillis);
        }

        /** The next {@link #millis()} call throws. */
        void failNextRead() {
            failNextRead.set(true);
        }

        @Override
        public long millis() {
            if (failNextRead.compareAndSet(true, false)) {
                throw new IllegalStateException("clock unavailable");
            }
            return millis.get();
        }


        @Override public Instant instant()        { return Instant.ofEpochMilli(millis.get()); }
        @Override public ZoneId getZone()         { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId z) { return this; }
    }

    private Fixtures() {}
}
