package com.nearbylite.geo;

import com.nearbylite.model.Coordinate;
import com.nearbylite.model.FriendSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeoFilterTest {

    private static final Coordinate ORIGIN = Coordinate.of(0, 0);

    private static FriendSnapshot friendAtLatitude(String id, double lat) {
        return FriendSnapshot.of(id, id, Coordinate.of(lat, 0), true, 0L);
    }

    @Test
    void keepsInsideAndOnBoundary_dropsOutside() {
        var filter = new GeoFilter(GeoFilter.DEFAULT_RADIUS_METERS);
        var inside = friendAtLatitude("inside", 0.05);    // ~5.6 km
        var outside = friendAtLatitude("outside", 0.1);   // ~11.1 km

        var kept = filter.filter(List.of(inside, outside), ORIGIN);

        assertEquals(List.of(inside), kept);
    }

    @Test
    void accepts_isInclusiveAtRadius() {
        var filter = new GeoFilter(10_000.0);
        assertTrue(filter.accepts(10_000.0));
        assertFalse(filter.accepts(10_000.0001));
        assertFalse(filter.accepts(Double.NaN));
    }

    @Test
    void friendsWithoutCoordinate_areNotKept() {
        var noFix = FriendSnapshot.of("ghost", "Ghost", null, true, 0L);
        assertTrue(GeoFilter.filter(List.of(noFix), ORIGIN, 10_000.0).isEmpty());
    }

    @Test
    void negativeRadius_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GeoFilter(-1));
    }
}
