package com.ignis.ruleengine.infra.metrics;

import java.time.Duration;

/**
 * Latency recorder.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     *
     * @throws IllegalArgumentException if the duration is negative
     */
    void record(Duration duration);

    /**
     * Number of recorded observations.
     */
    long count();
}
