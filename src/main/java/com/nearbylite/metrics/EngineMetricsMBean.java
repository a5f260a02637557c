package com.nearbylite.metrics;

public interface EngineMetricsMBean {
    long getTicks();
    long getRecomputations();
    long getThrottledTicks();
    long getEmissions();
    long getSuppressedEmissions();
    long getMalformedEntries();
    long getUpstreamErrors();
    long getFailedTicks();
    long getLastRecomputeMicros();
    double getThrottlingEffectiveness();
}
