package com.ignis.ruleengine.infra.metrics.internal;

import com.ignis.ruleengine.infra.metrics.Counter;
import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.ignis.ruleengine.infra.metrics.Timer;

import java.time.Duration;

/**
 * Fallback used when no provider is configured.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter NO_OP_COUNTER = new Counter() {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    };

    private static final Timer NO_OP_TIMER = new Timer() {
        public void record(Duration duration) {}
        public long count() { return 0L; }
    };

    @Override
    public Counter counter(String name, String... tags) {
        return NO_OP_COUNTER;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return NO_OP_TIMER;
    }
}
