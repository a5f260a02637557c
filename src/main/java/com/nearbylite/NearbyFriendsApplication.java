package com.nearbylite;

import com.nearbylite.config.ConfigLoader;
import com.nearbylite.metrics.EngineMetrics;
import com.nearbylite.topology.NearbyFriendsTopology;
import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.errors.StreamsUncaughtExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Hosts the nearby-friends engine inside Kafka Streams.
 *
 * Startup sequence:
 *   1. Resolve configuration (classpath file, system properties, env)
 *   2. Register engine metrics over JMX
 *   3. Start KafkaStreams on user-locations + friend-rosters
 *   4. Block until shutdown signal
 */
public class NearbyFriendsApplication {

    private static final Logger log = LoggerFactory.getLogger(NearbyFriendsApplication.class);

    public static void main(String[] args) throws Exception {
        var config = ConfigLoader.load();

        var metrics = new EngineMetrics();
        metrics.registerMBean();

        var topology = new NearbyFriendsTopology(config, metrics);
        var streams = new KafkaStreams(topology.build(), topology.streamsConfig());
        streams.setUncaughtExceptionHandler(ex -> {
            log.error("Uncaught StreamThread exception", ex);
            return StreamsUncaughtExceptionHandler.StreamThreadExceptionResponse.REPLACE_THREAD;
        });

        var latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            streams.close(Duration.ofSeconds(10));
            latch.countDown();
        }, "nearby-shutdown"));

        streams.start();
        log.info("Nearby friends engine running against {} (app id {})",
            config.bootstrapServers(), config.applicationId());
        latch.await();
        log.info("Final metrics: {}", metrics.toJson());
    }
}
