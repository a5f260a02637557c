package com.nearbylite.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.JMException;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.Locale;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free engine counters, readable over JMX at {@value #OBJECT_NAME}.
 */
public class EngineMetrics implements EngineMetricsMBean {

    private static final Logger log = LoggerFactory.getLogger(EngineMetrics.class);
    public static final String OBJECT_NAME = "com.nearbylite:type=EngineMetrics";

    private final LongAdder ticks               = new LongAdder();
    private final LongAdder recomputations      = new LongAdder();
    private final LongAdder throttledTicks      = new LongAdder();
    private final LongAdder emissions           = new LongAdder();
    private final LongAdder suppressedEmissions = new LongAdder();
    private final LongAdder malformedEntries    = new LongAdder();
    private final LongAdder upstreamErrors      = new LongAdder();
    private final LongAdder failedTicks         = new LongAdder();

    private volatile long lastRecomputeMicros = 0;

    public void recordTick()                 { ticks.increment(); }
    public void recordThrottled()            { throttledTicks.increment(); }
    public void recordEmission()             { emissions.increment(); }
    public void recordSuppressed()           { suppressedEmissions.increment(); }
    public void recordUpstreamError()        { upstreamErrors.increment(); }
    public void recordMalformed(int count)   { malformedEntries.add(count); }
    public void recordTickFailure()          { failedTicks.increment(); }

    public void recordRecompute(long micros) {
        recomputations.increment();
        lastRecomputeMicros = micros;
    }

    @Override public long getTicks()               { return ticks.sum(); }
    @Override public long getRecomputations()      { return recomputations.sum(); }
    @Override public long getThrottledTicks()      { return throttledTicks.sum(); }
    @Override public long getEmissions()           { return emissions.sum(); }
    @Override public long getSuppressedEmissions() { return suppressedEmissions.sum(); }
    @Override public long getMalformedEntries()    { return malformedEntries.sum(); }
    @Override public long getUpstreamErrors()      { return upstreamErrors.sum(); }
    @Override public long getFailedTicks()         { return failedTicks.sum(); }
    @Override public long getLastRecomputeMicros() { return lastRecomputeMicros; }

    /** Share of ranked ticks served from cache. */
    @Override
    public double getThrottlingEffectiveness() {
        long throttled = throttledTicks.sum();
        long total = throttled + recomputations.sum();
        if (total == 0) return 0.0;
        return (double) throttled / total;
    }

    /**
     * Registers this instance with the platform MBean server. A failure is logged,
     * metrics keep counting in-process.
     */
    public void registerMBean() {
        try {
            var mbs = ManagementFactory.getPlatformMBeanServer();
            var name = new ObjectName(OBJECT_NAME);
            if (!mbs.isRegistered(name)) {
                mbs.registerMBean(this, name);
                log.info("Engine metrics exposed over JMX at {}", OBJECT_NAME);
            }
        } catch (JMException e) {
            log.warn("Could not register {} MBean", OBJECT_NAME, e);
        }
    }

    public String toJson() {
        return String.format(Locale.ROOT, """
                {
                  "ticks": %d,
                  "recomputations": %d,
                  "throttled_ticks": %d,
                  "emissions": %d,
                  "suppressed_emissions": %d,
                  "malformed_entries": %d,
                  "upstream_errors": %d,
                  "failed_ticks": %d,
                  "last_recompute_us": %d,
                  "throttling_effectiveness": %.3f
                }""",
                getTicks(),
                getRecomputations(),
                getThrottledTicks(),
                getEmissions(),
                getSuppressedEmissions(),
                getMalformedEntries(),
                getUpstreamErrors(),
                getFailedTicks(),
                getLastRecomputeMicros(),
                getThrottlingEffectiveness());
    }
}
