package com.nearbylite.engine;

import com.nearbylite.config.ProximityConfig;
import com.nearbylite.metrics.EngineMetrics;
import com.nearbylite.model.FriendSnapshot;
import com.nearbylite.model.UserLocationSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fuses the user-location and roster sources into a ranked nearby-friends stream.
 * <p>
 * Each {@link #subscribe} builds an independent pipeline:
 * <pre>
 *   location source --> LatestValueChannel --\
 *                                             +--> engine thread: step() --> ChangeDetector --> listener
 *   roster source   --> LatestValueChannel --/
 * </pre>
 * Upstream callbacks only drop the newest value into a single-slot channel and wake the
 * pipeline's own thread. That thread drains both channels (values that piled up while it was
 * busy are collapsed, latest wins), runs one tick to completion, and goes back to waiting.
 * {@link EngineState} never leaves that thread, so nothing is locked. Listeners are invoked
 * on the engine thread as well.
 * <p>
 * Ticks are processed once a roster has arrived; a missing user location puts the pipeline in
 * degraded mode instead of holding it back.
 */
public final class ProximityEngine {

    private static final Logger log = LoggerFactory.getLogger(ProximityEngine.class);
    private static final AtomicInteger PIPELINE_IDS = new AtomicInteger();

    private final UpstreamSource<UserLocationSample> locations;
    private final UpstreamSource<List<FriendSnapshot>> rosters;
    private final NearbyFriendsCalculator calculator;
    private final Clock clock;
    private final EngineMetrics metrics;

    public ProximityEngine(UpstreamSource<UserLocationSample> locations,
                           UpstreamSource<List<FriendSnapshot>> rosters,
                           ProximityConfig config) {
        this(locations, rosters, config, Clock.systemUTC(), new EngineMetrics());
    }

    public ProximityEngine(UpstreamSource<UserLocationSample> locations,
                           UpstreamSource<List<FriendSnapshot>> rosters,
                           ProximityConfig config,
                           Clock clock,
                           EngineMetrics metrics) {
        this.locations = Objects.requireNonNull(locations, "locations");
        this.rosters = Objects.requireNonNull(rosters, "rosters");
        this.calculator = new NearbyFriendsCalculator(config);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public EngineMetrics metrics() {
        return metrics;
    }

    /**
     * Starts a pipeline that pushes snapshots to {@code listener} until the returned
     * subscription is closed.
     */
    public EngineSubscription subscribe(NearbyFriendsListener listener) {
        Objects.requireNonNull(listener, "listener");
        var pipeline = new Pipeline(PIPELINE_IDS.incrementAndGet(), listener);
        pipeline.start();
        return pipeline;
    }

    /**
     * Subscription returned by {@link #subscribe}. Closing detaches both upstream sources
     * and stops the engine thread; the pipeline's state goes with it.
     */
    public interface EngineSubscription extends Subscription {

        boolean isActive();

        /** Waits for the engine thread to exit after {@link #close()}. */
        boolean awaitTermination(Duration timeout) throws InterruptedException;
    }

    private final class Pipeline implements EngineSubscription, Runnable {

        private final int id;
        private final NearbyFriendsListener listener;
        private final ArrayBlockingQueue<Boolean> wakeups = new ArrayBlockingQueue<>(1);
        private final LatestValueChannel<UserLocationSample> locationChannel;
        private final LatestValueChannel<List<FriendSnapshot>> rosterChannel;
        private final AtomicBoolean closed = new AtomicBoolean();
        private final ExecutorService executor;
        private final long pollTimeoutMs;

        private volatile boolean running = true;
        private volatile Subscription locationSubscription;
        private volatile Subscription rosterSubscription;

        Pipeline(int id, NearbyFriendsListener listener) {
            this.id = id;
            this.listener = listener;
            this.pollTimeoutMs = calculator.config().pollTimeoutMs();
            this.locationChannel = new LatestValueChannel<>("user-location", this::wakeUp);
            this.rosterChannel = new LatestValueChannel<>("friend-roster", this::wakeUp);
            this.executor = Executors.newSingleThreadExecutor(r -> {
                var t = new Thread(r, "nearby-engine-" + id);
                t.setDaemon(true);
                return t;
            });
        }

        void start() {
            executor.execute(this);
            try {
                locationSubscription = locations.subscribe(new ChannelListener<>(locationChannel));
                rosterSubscription = rosters.subscribe(new ChannelListener<>(rosterChannel));
            } catch (RuntimeException e) {
                log.error("[pipeline {}] failed to attach upstream sources", id, e);
                close();
                throw e;
            }
            log.info("[pipeline {}] started", id);
        }

        private void wakeUp() {
            // capacity 1: a pending wakeup already covers this value
            wakeups.offer(Boolean.TRUE);
        }

        @Override
        public void run() {
            var state = EngineState.initial();
            List<FriendSnapshot> roster = null;
            UserLocationSample sample = null;
            try {
                while (running) {
                    if (wakeups.poll(pollTimeoutMs, TimeUnit.MILLISECONDS) == null) continue;

                    var newSample = locationChannel.poll();
                    var newRoster = rosterChannel.poll();
                    if (newSample == null && newRoster == null) continue;
                    if (newSample != null) sample = newSample;
                    if (newRoster != null) roster = newRoster;
                    if (roster == null || !running) continue;

                    try {
                        state = tick(state, roster, sample);
                    } catch (RuntimeException e) {
                        // state is left as it was before the failed tick
                        metrics.recordTickFailure();
                        log.error("[pipeline {}] tick failed, keeping last result", id, e);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                log.info("[pipeline {}] stopped, engine state released", id);
            }
        }

        private EngineState tick(EngineState state, List<FriendSnapshot> roster, UserLocationSample sample) {
            metrics.recordTick();
            long startNanos = System.nanoTime();
            StepResult result = calculator.step(state, roster, sample, clock.millis());

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
                try {
                    listener.onNearbyFriends(result.snapshot());
                } catch (RuntimeException e) {
                    log.error("[pipeline {}] listener failed on snapshot of {} friends", id, result.snapshot().size(), e);
                }
            } else {
                metrics.recordSuppressed();
            }
            return result.state();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            running = false;
            detach(locationSubscription, locationChannel.name());
            detach(rosterSubscription, rosterChannel.name());
            executor.shutdownNow();
        }

        private void detach(Subscription subscription, String name) {
            if (subscription == null) return;
            try {
                subscription.close();
            } catch (RuntimeException e) {
                log.warn("[pipeline {}] failed to detach {} source", id, name, e);
            }
        }

        @Override
        public boolean isActive() {
            return !closed.get();
        }

        @Override
        public boolean awaitTermination(Duration timeout) throws InterruptedException {
            return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        private final class ChannelListener<T> implements UpstreamListener<T> {

            private final LatestValueChannel<T> channel;

            ChannelListener(LatestValueChannel<T> channel) {
                this.channel = channel;
            }

            @Override
            public void onNext(T value) {
                if (closed.get()) return;
                if (value == null) {
                    log.warn("[pipeline {}] null value from {} source ignored", id, channel.name());
                    return;
                }
                channel.offer(value);
            }

            @Override
            public void onError(Throwable error) {
                metrics.recordUpstreamError();
                log.warn("[pipeline {}] {} source failed, serving last known result", id, channel.name(), error);
            }

            @Override
            public void onComplete() {
                log.info("[pipeline {}] {} source completed, serving last known result", id, channel.name());
            }
        }
    }
}
