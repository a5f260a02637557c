package com.nearbylite.model;

import com.nearbylite.topology.JsonSerde;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    void proximityBuckets_followDistanceBands() {
        assertEquals(ProximityBucket.VERY_CLOSE, ProximityBucket.forDistance(299.9));
        assertEquals(ProximityBucket.NEARBY, ProximityBucket.forDistance(300.0));
        assertEquals(ProximityBucket.NEARBY, ProximityBucket.forDistance(1_999.0));
        assertEquals(ProximityBucket.IN_TOWN, ProximityBucket.forDistance(2_000.0));
        assertEquals(ProximityBucket.UNKNOWN, ProximityBucket.forDistance(Double.NaN));
    }

    @Test
    void coordinateValidity() {
        assertTrue(Coordinate.of(-90, 180).isValid());
        assertFalse(Coordinate.of(90.01, 0).isValid());
        assertFalse(Coordinate.of(0, -180.5).isValid());
        assertFalse(Coordinate.of(Double.POSITIVE_INFINITY, 0).isValid());
    }

    @Test
    void blankAvatar_becomesAbsent() {
        var friend = new FriendSnapshot("f1", null, "  ", null, false, 0L);
        assertNull(friend.avatarUrl());
        assertEquals("", friend.displayName());
        assertFalse(friend.hasCoordinate());
    }

    @Test
    void friendSnapshot_readsWireFormat() throws Exception {
        var json = """
            {"id":"f1","display_name":"Ana","coordinate":{"lat":1.5,"lon":-2.0},
             "online":true,"last_active_ms":123,"unknown_field":"ignored"}
            """;

        var friend = JsonSerde.MAPPER.readValue(json, FriendSnapshot.class);

        assertEquals(FriendSnapshot.of("f1", "Ana", Coordinate.of(1.5, -2.0), true, 123L), friend);
    }

    @Test
    void friendSnapshot_withoutCoordinate_decodesToNull() throws Exception {
        var friend = JsonSerde.MAPPER.readValue(
            "{\"id\":\"f2\",\"display_name\":\"Bo\",\"online\":false,\"last_active_ms\":0}", FriendSnapshot.class);
        assertNull(friend.coordinate());
    }
}
