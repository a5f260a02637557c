package com.nearbylite.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nearbylite.geo.DistanceFormatter;

/**
 * One ranked entry of a nearby-friends snapshot. Lower {@code rankScore} sorts first.
 * Entries produced before the user's own location is known carry NaN distance and score.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NearbyFriendResult(
    @JsonProperty("id") String id,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("avatar_url") String avatarUrl,
    @JsonProperty("coordinate") Coordinate coordinate,
    @JsonProperty("distance_m") double distanceMeters,
    @JsonProperty("formatted_distance") String formattedDistance,
    @JsonProperty("online") boolean isOnline,
    @JsonProperty("last_active_ms") long lastActiveAtMillis,
    @JsonProperty("rank_score") float rankScore,
    @JsonProperty("bucket") ProximityBucket proximityBucket
) {

    public static NearbyFriendResult ranked(FriendSnapshot friend, double distanceMeters, float rankScore) {
        return new NearbyFriendResult(
            friend.id(),
            friend.displayName(),
            friend.avatarUrl(),
            friend.coordinate(),
            distanceMeters,
            DistanceFormatter.format(distanceMeters),
            friend.isOnline(),
            friend.lastActiveAtMillis(),
            rankScore,
            ProximityBucket.forDistance(distanceMeters)
        );
    }

    /** Pass-through entry for when the user's own location is unknown. */
    public static NearbyFriendResult unranked(FriendSnapshot friend) {
        return ranked(friend, Double.NaN, Float.NaN);
    }

    @JsonIgnore
    public boolean hasDistance() {
        return !Double.isNaN(distanceMeters);
    }
}
