package com.nearbylite.engine;

import com.nearbylite.config.ProximityConfig;
import com.nearbylite.model.Coordinate;
import com.nearbylite.model.FriendSnapshot;
import com.nearbylite.model.NearbyFriendResult;
import com.nearbylite.model.ProximityBucket;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.nearbylite.engine.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class NearbyFriendsCalculatorTest {

    private final NearbyFriendsCalculator calculator = new NearbyFriendsCalculator(ProximityConfig.defaults());

    private static List<String> ids(List<NearbyFriendResult> results) {
        return results.stream().map(NearbyFriendResult::id).toList();
    }

    @Test
    void endToEnd_rankedAndFormatted() {
        var a = FriendSnapshot.of("A", "Ana", Coordinate.of(0.0045, 0), true, T0);
        var b = FriendSnapshot.of("B", "Ben", Coordinate.of(0.018, 0), true, T0);

        var step = calculator.step(EngineState.initial(), List.of(b, a), userAt(0, 0, T0), T0);

        assertTrue(step.emit());
        assertEquals(List.of("A", "B"), ids(step.snapshot()));
        assertEquals("500 m", step.snapshot().get(0).formattedDistance());
        assertEquals("2.0 km", step.snapshot().get(1).formattedDistance());
        assertEquals(ProximityBucket.NEARBY, step.snapshot().get(0).proximityBucket());
        assertEquals(ProximityBucket.IN_TOWN, step.snapshot().get(1).proximityBucket());
    }

    @Test
    void recomputation_isDeterministic() {
        var roster = new ArrayList<FriendSnapshot>();
        for (int i = 0; i < 50; i++) {
            roster.add(FriendSnapshot.of("f" + i, "F" + i,
                Coordinate.of(0.0001 * (i % 7), 0.0001 * (i % 5)), i % 2 == 0, T0 - i * 1_000L));
        }
        var sample = userAt(0, 0, T0);

        var first = calculator.recompute(roster, sample, T0).results();
        var second = calculator.recompute(new ArrayList<>(roster), sample, T0).results();

        assertEquals(first, second);
        for (int i = 1; i < first.size(); i++) {
            assertTrue(NearbyFriendsCalculator.RANK_ORDER.compare(first.get(i - 1), first.get(i)) <= 0);
        }
    }

    @Test
    void subMeterTies_sortByAscendingDistance() {
        var roster = List.of(
            friendMetersNorth("d", 1.1, T0),
            friendMetersNorth("b", 0.9, T0),
            friendMetersNorth("c", 1.0, T0),
            friendMetersNorth("a", 0.8, T0));

        var results = calculator.recompute(roster, userAt(0, 0, T0), T0).results();

        assertEquals(List.of("a", "b", "c", "d"), ids(results));
    }

    @Test
    void equalScoreAndDistance_fallBackToId() {
        var roster = List.of(
            friendMetersNorth("zed", 50, T0),
            friendMetersNorth("amy", 50, T0),
            friendMetersNorth("kim", 50, T0));

        var results = calculator.recompute(roster, userAt(0, 0, T0), T0).results();

        assertEquals(List.of("amy", "kim", "zed"), ids(results));
    }

    @Test
    void geoFilter_isExact() {
        var roster = List.of(
            friendMetersNorth("in", 9_990, T0),
            friendMetersNorth("out", 10_010, T0));

        var results = calculator.recompute(roster, userAt(0, 0, T0), T0).results();

        assertEquals(List.of("in"), ids(results));
        results.forEach(r -> assertTrue(r.distanceMeters() <= ProximityConfig.GEO_FILTER_RADIUS_METERS));
    }

    @Test
    void identicalSampleOneSecondLater_reusesCache() {
        var roster = rosterOf(20, 100);
        var first = calculator.step(EngineState.initial(), roster, userAt(0, 0, T0), T0);

        var second = calculator.step(first.state(), roster, userAt(0, 0, T0 + 1_000), T0 + 1_000);

        assertTrue(first.recomputed());
        assertFalse(second.recomputed());
        assertFalse(second.emit());
        assertSame(first.state().cache(), second.state().cache());
    }

    @Test
    void displacementOf25Meters_forcesRecomputeInsideTimeWindow() {
        var roster = rosterOf(5, 100);
        var first = calculator.step(EngineState.initial(), roster, userAt(0, 0, T0), T0);

        var moved = userAt(metersToLatDegrees(25), 0, T0 + 2_000);
        var second = calculator.step(first.state(), roster, moved, T0 + 2_000);

        assertEquals(RecalculationReason.MOVED, second.reason());
        assertEquals(moved, second.state().cache().userSample());
    }

    @Test
    void stationaryUser_recomputesAfterTenSeconds() {
        var roster = rosterOf(5, 100);
        var first = calculator.step(EngineState.initial(), roster, userAt(0, 0, T0), T0);

        var second = calculator.step(first.state(), roster, userAt(0, 0, T0 + 10_001), T0 + 10_001);

        assertEquals(RecalculationReason.TIME_ELAPSED, second.reason());
        assertEquals(T0 + 10_001, second.state().cache().recalculatedAtMillis());
    }

    @Test
    void rosterChange_recomputesAndEmits() {
        var roster = rosterOf(5, 100);
        var first = calculator.step(EngineState.initial(), roster, userAt(0, 0, T0), T0);

        var grown = new ArrayList<>(roster);
        grown.add(friendMetersNorth("newcomer", 300, T0));
        var second = calculator.step(first.state(), grown, userAt(0, 0, T0 + 100), T0 + 100);

        assertEquals(RecalculationReason.ROSTER_CHANGED, second.reason());
        assertTrue(second.emit());
        assertEquals(6, second.snapshot().size());
    }

    @Test
    void jitterBelowOneMeter_isNotEmittedAgain() {
        var roster = List.of(friendMetersNorth("a", 500, T0));
        var first = calculator.step(EngineState.initial(), roster, userAt(0, 0, T0), T0);

        var nudged = List.of(friendMetersNorth("a", 500.4, T0));
        var second = calculator.step(first.state(), nudged, userAt(0, 0, T0 + 100), T0 + 100);

        var moved = List.of(friendMetersNorth("a", 501.5, T0));
        var third = calculator.step(second.state(), moved, userAt(0, 0, T0 + 200), T0 + 200);

        assertTrue(second.recomputed());
        assertFalse(second.emit());
        assertTrue(third.emit());
    }

    @Test
    void oversizedRoster_isCapped_andResizesCleanly() {
        var state = EngineState.initial();
        var sample = userAt(0, 0, T0);

        var big = calculator.step(state, rosterOf(1_500, 10), sample, T0);
        assertEquals(ProximityConfig.MAX_TRACKED_FRIENDS, big.snapshot().size());

        var small = calculator.step(big.state(), rosterOf(400, 10), sample, T0 + 1);
        assertEquals(400, small.snapshot().size());

        var medium = calculator.step(small.state(), rosterOf(800, 10), sample, T0 + 2);
        assertEquals(800, medium.snapshot().size());
    }

    @Test
    void parallelPath_matchesSequentialPath() {
        var roster = rosterOf(300, 10);
        var sample = userAt(0, 0, T0);
        var sequential = new NearbyFriendsCalculator(ProximityConfig.builder().parallelThreshold(10_000).build());
        var parallel = new NearbyFriendsCalculator(ProximityConfig.builder().parallelThreshold(1).build());

        assertEquals(sequential.recompute(roster, sample, T0).results(), parallel.recompute(roster, sample, T0).results());
    }

    @Test
    void malformedCoordinate_skipsOnlyThatEntry() {
        var roster = List.of(
            friendMetersNorth("good", 100, T0),
            FriendSnapshot.of("nan", "NaN", Coordinate.of(Double.NaN, 0), true, T0),
            FriendSnapshot.of("bad-lat", "Bad", Coordinate.of(95.0, 0), true, T0),
            FriendSnapshot.of("no-fix", "Nobody", null, true, T0));

        var step = calculator.step(EngineState.initial(), roster, userAt(0, 0, T0), T0);

        assertEquals(List.of("good"), ids(step.snapshot()));
        assertEquals(2, step.malformedCount());
    }

    @Test
    void noUserLocationYet_passesFriendsThroughUnranked() {
        var roster = List.of(
            friendMetersNorth("b", 900, T0),
            FriendSnapshot.of("ghost", "Ghost", null, true, T0),
            friendMetersNorth("a", 100, T0));

        var step = calculator.step(EngineState.initial(), roster, null, T0);

        assertTrue(step.emit());
        assertEquals(List.of("b", "a"), ids(step.snapshot()));
        step.snapshot().forEach(r -> {
            assertFalse(r.hasDistance());
            assertEquals("--", r.formattedDistance());
            assertEquals(ProximityBucket.UNKNOWN, r.proximityBucket());
        });
        assertFalse(step.state().cache().isRanked());
    }

    @Test
    void missingLocationAfterRanking_servesCachedResult() {
        var roster = rosterOf(3, 100);
        var ranked = calculator.step(EngineState.initial(), roster, userAt(0, 0, T0), T0);

        var degraded = calculator.step(ranked.state(), roster, null, T0 + 50_000);

        assertEquals(ranked.snapshot(), degraded.snapshot());
        assertFalse(degraded.emit());
    }
}
