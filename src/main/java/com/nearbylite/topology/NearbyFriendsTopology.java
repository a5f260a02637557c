package com.nearbylite.topology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nearbylite.config.AppConfig;
import com.nearbylite.engine.NearbyFriendsCalculator;
import com.nearbylite.metrics.EngineMetrics;
import com.nearbylite.model.NearbyFriendResult;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.Topology;
import org.apache.kafka.streams.errors.LogAndContinueExceptionHandler;
import org.apache.kafka.streams.state.Stores;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * Raw Processor API topology:
 * <pre>
 *   user-locations --\
 *                     +--> nearby-processor --> nearby-friends
 *   friend-rosters --/        |
 *                             +-- latest-user-location (in-memory KV)
 *                             +-- latest-friend-roster (in-memory KV)
 * </pre>
 * Both inputs must be co-partitioned by user id.
 */
public class NearbyFriendsTopology {

    static final JsonSerde<List<NearbyFriendResult>> RESULT_SERDE = new JsonSerde<>(new TypeReference<>() {});

    private final AppConfig config;
    private final EngineMetrics metrics;

    public NearbyFriendsTopology(AppConfig config, EngineMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    public Topology build() {
        var topology = new Topology();
        var calculator = new NearbyFriendsCalculator(config.proximity());
        var metricsInterval = Duration.ofMillis(config.metricsLogIntervalMs());

        var locationStore = Stores.keyValueStoreBuilder(
            Stores.inMemoryKeyValueStore(NearbyFriendsProcessor.LOCATION_STORE),
            Serdes.String(),
            NearbyFriendsProcessor.SAMPLE_SERDE);
        var rosterStore = Stores.keyValueStoreBuilder(
            Stores.inMemoryKeyValueStore(NearbyFriendsProcessor.ROSTER_STORE),
            Serdes.String(),
            NearbyFriendsProcessor.ROSTER_SERDE);

        topology
            .addSource("location-source", new StringDeserializer(), new ByteArrayDeserializer(),
                TopicNames.USER_LOCATIONS)
            .addSource("roster-source", new StringDeserializer(), new ByteArrayDeserializer(),
                TopicNames.FRIEND_ROSTERS)
            .addProcessor("nearby-processor",
                () -> new NearbyFriendsProcessor(calculator, metrics, metricsInterval),
                "location-source", "roster-source")
            .addStateStore(locationStore, "nearby-processor")
            .addStateStore(rosterStore, "nearby-processor")
            .addSink("nearby-sink", TopicNames.NEARBY_FRIENDS,
                new StringSerializer(), RESULT_SERDE.serializer(), "nearby-processor");

        return topology;
    }

    public Properties streamsConfig() {
        var props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG,    config.applicationId());
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG, config.bootstrapServers());
        props.put(StreamsConfig.COMMIT_INTERVAL_MS_CONFIG, 100);
        props.put(StreamsConfig.DEFAULT_DESERIALIZATION_EXCEPTION_HANDLER_CLASS_CONFIG,
            LogAndContinueExceptionHandler.class.getName());
        props.put(StreamsConfig.DEFAULT_KEY_SERDE_CLASS_CONFIG,   Serdes.String().getClass().getName());
        props.put(StreamsConfig.DEFAULT_VALUE_SERDE_CLASS_CONFIG, Serdes.ByteArray().getClass().getName());
        return props;
    }
}
