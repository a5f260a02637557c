package com.nearbylite.engine;

import com.nearbylite.config.ProximityConfig;
import com.nearbylite.model.Coordinate;
import com.nearbylite.geo.DistanceCalculator;
import com.nearbylite.geo.GeoFilter;
import com.nearbylite.model.FriendSnapshot;
import com.nearbylite.model.NearbyFriendResult;
import com.nearbylite.model.ProximityBucket;
import com.nearbylite.model.UserLocationSample;
import com.nearbylite.ranking.SmartRankingScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Pure tick function: {@code step(state, roster, sample, now) -> (state', snapshot, emit)}.
 * Holds configuration only; every bit of mutable memory travels in {@link EngineState}.
 * Safe to share between threads as long as each state value has a single owner.
 */
public final class NearbyFriendsCalculator {

    private static final Logger log = LoggerFactory.getLogger(NearbyFriendsCalculator.class);

    /** rankScore, then distance, then id. */
    public static final Comparator<NearbyFriendResult> RANK_ORDER =
        Comparator.comparingDouble(NearbyFriendResult::rankScore)
            .thenComparingDouble(NearbyFriendResult::distanceMeters)
            .thenComparing(NearbyFriendResult::id);

    private final ProximityConfig config;
    private final GeoFilter geoFilter;
    private final SmartRankingScorer scorer;
    private final RecalculationPolicy policy;
    private final ChangeDetector changeDetector;

    public NearbyFriendsCalculator(ProximityConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.geoFilter = new GeoFilter(config.geoFilterRadiusMeters());
        this.scorer = new SmartRankingScorer(config);
        this.policy = new RecalculationPolicy(config);
        this.changeDetector = new ChangeDetector(config);
    }

    public ProximityConfig config() {
        return config;
    }

    /**
     * Runs one tick.
     *
     * @param roster latest full roster, never null
     * @param sample latest user location, null while the user's own fix is unknown
     */
    public StepResult step(EngineState state, List<FriendSnapshot> roster,
                           UserLocationSample sample, long nowMillis) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(roster, "roster");

        var entries = withoutNullEntries(roster);
        int nullEntries = roster.size() - entries.size();
        if (sample == null) {
            return degraded(state, entries, nullEntries);
        }

        long fingerprint = RosterFingerprint.of(entries);
        var reason = policy.evaluate(state.cache(), sample, fingerprint, nowMillis);

        EngineState next = state;
        List<NearbyFriendResult> snapshot;
        int malformed = nullEntries;
        if (reason.recompute()) {
            log.debug("Recalculating distances: reason={} roster={}", reason, entries.size());
            var computed = recompute(entries, sample, nowMillis);
            malformed += computed.malformed();
            snapshot = computed.results();
            next = state.withCache(new ResultCache(snapshot, sample, fingerprint, nowMillis));
            log.info("Distance updated for {} friends", snapshot.size());
        } else {
            snapshot = state.cache().results();
        }
        return emitThroughDetector(next, snapshot, reason, malformed);
    }

    /**
     * Distance, geo-filter, score and sort over the capped roster. Deterministic for fixed inputs.
     */
    public Computation recompute(List<FriendSnapshot> roster, UserLocationSample sample, long nowMillis) {
        var capped = cap(roster);
        var center = sample.coordinate();

        List<Ranked> mapped;
        if (capped.size() > config.parallelThreshold()) {
            mapped = capped.parallelStream()
                .map(f -> rank(f, center, nowMillis))
                .collect(Collectors.toList());
        } else {
            mapped = new ArrayList<>(capped.size());
            for (var f : capped) {
                mapped.add(rank(f, center, nowMillis));
            }
        }

        var results = new ArrayList<NearbyFriendResult>(mapped.size());
        int malformed = 0;
        int outOfRange = 0;
        for (var r : mapped) {
            if (r.result() != null) {
                results.add(r.result());
            } else if (r.malformed()) {
                malformed++;
            } else if (r == Ranked.OUT_OF_RANGE) {
                outOfRange++;
            }
        }
        results.sort(RANK_ORDER);

        if (malformed > 0) {
            log.warn("Skipped {} roster entries with malformed coordinates", malformed);
        }
        if (outOfRange > 0) {
            log.debug("Geo-filter dropped {} of {} friends beyond {} m",
                outOfRange, capped.size(), geoFilter.radiusMeters());
        }
        if (log.isDebugEnabled() && !results.isEmpty()) {
            log.debug("Proximity buckets: {}", bucketCounts(results));
        }
        return new Computation(List.copyOf(results), malformed);
    }

    private StepResult degraded(EngineState state, List<FriendSnapshot> roster, int nullEntries) {
        List<NearbyFriendResult> snapshot;
        if (state.cache().isRanked()) {
            snapshot = state.cache().results();
        } else {
            log.debug("User location unavailable, passing {} friends through without distances", roster.size());
            var passThrough = new ArrayList<NearbyFriendResult>();
            for (var f : cap(roster)) {
                if (f.hasCoordinate()) {
                    passThrough.add(NearbyFriendResult.unranked(f));
                }
            }
            snapshot = List.copyOf(passThrough);
        }
        return emitThroughDetector(state, snapshot, RecalculationReason.NONE, nullEntries);
    }

    private StepResult emitThroughDetector(EngineState state, List<NearbyFriendResult> snapshot,
                                           RecalculationReason reason, int malformed) {
        boolean emit = changeDetector.shouldEmit(state.lastEmitted(), snapshot);
        var next = emit ? state.withLastEmitted(snapshot) : state;
        return new StepResult(next, snapshot, emit, reason, malformed);
    }

    private static List<FriendSnapshot> withoutNullEntries(List<FriendSnapshot> roster) {
        int nulls = 0;
        for (var f : roster) {
            if (f == null) nulls++;
        }
        if (nulls == 0) return roster;
        log.warn("Dropped {} null entries from roster of {}", nulls, roster.size());
        var kept = new ArrayList<FriendSnapshot>(roster.size() - nulls);
        for (var f : roster) {
            if (f != null) kept.add(f);
        }
        return kept;
    }

    private List<FriendSnapshot> cap(List<FriendSnapshot> roster) {
        int max = config.maxTrackedFriends();
        if (roster.size() <= max) return roster;
        log.warn("Large friend list detected, limiting for performance: total={} processed={}", roster.size(), max);
        return roster.subList(0, max);
    }

    private Ranked rank(FriendSnapshot friend, Coordinate center, long nowMillis) {
        if (friend == null) return Ranked.MALFORMED;
        var coordinate = friend.coordinate();
        if (coordinate == null) return Ranked.NO_LOCATION;
        try {
            if (!coordinate.isValid()) {
                log.debug("Malformed coordinate for friend={}: {}", friend.id(), coordinate);
                return Ranked.MALFORMED;
            }
            double distance = DistanceCalculator.distance(center, coordinate);
            if (Double.isNaN(distance)) return Ranked.MALFORMED;
            if (!geoFilter.accepts(distance)) return Ranked.OUT_OF_RANGE;
            float score = scorer.score(distance, friend.lastActiveAtMillis(), friend.isOnline(), nowMillis);
            return new Ranked(NearbyFriendResult.ranked(friend, distance, score), false);
        } catch (RuntimeException e) {
            log.warn("Distance computation failed for friend={}, skipping entry", friend.id(), e);
            return Ranked.MALFORMED;
        }
    }

    private static EnumMap<ProximityBucket, Integer> bucketCounts(List<NearbyFriendResult> results) {
        var counts = new EnumMap<ProximityBucket, Integer>(ProximityBucket.class);
        for (var r : results) {
            counts.merge(r.proximityBucket(), 1, Integer::sum);
        }
        return counts;
    }

    /** Result of one full recomputation. */
    public record Computation(List<NearbyFriendResult> results, int malformed) {}

    private record Ranked(NearbyFriendResult result, boolean malformed) {
        static final Ranked OUT_OF_RANGE = new Ranked(null, false);
        static final Ranked NO_LOCATION = new Ranked(null, false);
        static final Ranked MALFORMED = new Ranked(null, true);
    }
}
