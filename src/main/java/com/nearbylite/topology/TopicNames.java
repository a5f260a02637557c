package com.nearbylite.topology;

public final class TopicNames {

    /** key: user id, value: JSON {@code UserLocationSample} */
    public static final String USER_LOCATIONS = "user-locations";
    /** key: user id, value: JSON array of {@code FriendSnapshot}, the full roster */
    public static final String FRIEND_ROSTERS = "friend-rosters";
    /** key: user id, value: JSON array of {@code NearbyFriendResult}, ascending by rank */
    public static final String NEARBY_FRIENDS = "nearby-friends";

    private TopicNames() {}
}
