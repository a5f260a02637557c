package com.nearbylite.topology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nearbylite.engine.EngineState;
import com.nearbylite.engine.NearbyFriendsCalculator;
import com.nearbylite.engine.StepResult;
import com.nearbylite.metrics.EngineMetrics;
import com.nearbylite.model.FriendSnapshot;
import com.nearbylite.model.NearbyFriendResult;
import com.nearbylite.model.UserLocationSample;
import org.apache.kafka.streams.processor.PunctuationType;
import org.apache.kafka.streams.processor.api.Processor;
import org.apache.kafka.streams.processor.api.ProcessorContext;
import org.apache.kafka.streams.processor.api.Record;
import org.apache.kafka.streams.processor.api.RecordMetadata;
import org.apache.kafka.streams.state.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the nearby-friends tick per user key.
 * <p>
 * Both input topics land here as raw bytes; the record's topic says which one it is.
 * The latest sample and roster per user sit in state stores, the per-user
 * {@link EngineState} in a processor-local map. A StreamThread owns its tasks exclusively,
 * so each user's state has one writer. Snapshots are forwarded only when the change
 * detector lets them through.
 * <p>
 * A tombstone (null value) on either topic deletes that user's stored input and drops
 * the user's engine state, so the map holds one entry per user that still has a roster.
 */
public class NearbyFriendsProcessor implements Processor<String, byte[], String, List<NearbyFriendResult>> {

    private static final Logger log = LoggerFactory.getLogger(NearbyFriendsProcessor.class);

    public static final String LOCATION_STORE = "latest-user-location";
    public static final String ROSTER_STORE   = "latest-friend-roster";

    static final JsonSerde<UserLocationSample> SAMPLE_SERDE = new JsonSerde<>(new TypeReference<>() {});
    static final JsonSerde<List<FriendSnapshot>> ROSTER_SERDE = new JsonSerde<>(new TypeReference<>() {});

    private final NearbyFriendsCalculator calculator;
    private final EngineMetrics metrics;
    private final Duration metricsInterval;

    private ProcessorContext<String, List<NearbyFriendResult>> context;
    private KeyValueStore<String, UserLocationSample> locationStore;
    private KeyValueStore<String, List<FriendSnapshot>> rosterStore;

    // rebuilt from the stores after a restart: first tick per user recomputes
    private final Map<String, EngineState> engineStates = new HashMap<>();

    public NearbyFriendsProcessor(NearbyFriendsCalculator calculator, EngineMetrics metrics, Duration metricsInterval) {
        this.calculator = calculator;
        this.metrics = metrics;
        this.metricsInterval = metricsInterval;
    }

    @Override
    public void init(ProcessorContext<String, List<NearbyFriendResult>> context) {
        this.context = context;
        this.locationStore = context.getStateStore(LOCATION_STORE);
        this.rosterStore = context.getStateStore(ROSTER_STORE);

        context.schedule(metricsInterval, PunctuationType.WALL_CLOCK_TIME, ts ->
            log.info("[PROCESSOR task={}] users={} metrics={}",
                context.taskId(), engineStates.size(), metrics.toJson()));
    }

    @Override
    public void process(Record<String, byte[]> record) {
        var userId = record.key();
        if (userId == null) {
            log.warn("Dropping record without key");
            return;
        }

        var topic = context.recordMetadata().map(RecordMetadata::topic).orElse("");
        if (record.value() == null) {
            evict(topic, userId);
            return;
        }
        try {
            switch (topic) {
                case TopicNames.USER_LOCATIONS -> locationStore.put(userId, SAMPLE_SERDE.decode(record.value()));
                case TopicNames.FRIEND_ROSTERS -> rosterStore.put(userId, ROSTER_SERDE.decode(record.value()));
                default -> {
                    log.warn("Record from unexpected topic '{}' ignored", topic);
                    return;
                }
            }
        } catch (IOException e) {
            metrics.recordUpstreamError();
            log.warn("Undecodable record on {} for user={}, serving last known result", topic, userId, e);
            return;
        }

        var roster = rosterStore.get(userId);
        if (roster == null) return;

        var sample = locationStore.get(userId);
        var state = engineStates.getOrDefault(userId, EngineState.initial());

        metrics.recordTick();
        long startNanos = System.nanoTime();
        StepResult result;
        try {
            result = calculator.step(state, roster, sample, context.currentSystemTimeMs());
        } catch (RuntimeException e) {
            metrics.recordTickFailure();
            log.error("Tick failed for user={}, keeping last result", userId, e);
            return;
        }
        engineStates.put(userId, result.state());

        if (result.recomputed()) {
            metrics.recordRecompute((System.nanoTime() - startNanos) / 1_000);
        } else if (sample != null) {
            metrics.recordThrottled();
        }
        if (result.malformedCount() > 0) {
            metrics.recordMalformed(result.malformedCount());
        }

        if (result.emit()) {
            metrics.recordEmission();
            context.forward(new Record<>(userId, result.snapshot(), record.timestamp()));
        } else {
            metrics.recordSuppressed();
        }
    }

    private void evict(String topic, String userId) {
        switch (topic) {
            case TopicNames.USER_LOCATIONS -> locationStore.delete(userId);
            case TopicNames.FRIEND_ROSTERS -> rosterStore.delete(userId);
            default -> {
                log.warn("Tombstone from unexpected topic '{}' ignored", topic);
                return;
            }
        }
        engineStates.remove(userId);
        log.debug("Tombstone on {} for user={}, engine state dropped", topic, userId);
    }

    @Override
    public void close() {
        log.info("[PROCESSOR] closing with {} tracked users", engineStates.size());
        engineStates.clear();
    }
}
