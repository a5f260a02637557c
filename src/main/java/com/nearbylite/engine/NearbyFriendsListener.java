package com.nearbylite.engine;

import com.nearbylite.model.NearbyFriendResult;

import java.util.List;

/**
 * Downstream consumer. Every call carries a complete replacement snapshot, ascending by rank.
 */
@FunctionalInterface
public interface NearbyFriendsListener {

    void onNearbyFriends(List<NearbyFriendResult> snapshot);
}
