package com.ignis.ruleengine.infra.metrics.impl.prometheus;

import com.ignis.ruleengine.infra.metrics.Counter;

/**
 * Binds an Ignis {@link Counter} to one label combination of a Prometheus counter.
 */
final class PrometheusCounterAdapter implements Counter {

    private final io.prometheus.client.Counter.Child counter;

    PrometheusCounterAdapter(io.prometheus.client.Counter counter, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.counter = counter.labels(labelValues);
    }

    @Override
    public void increment() {
        counter.inc();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
        }
        counter.inc(amount);
    }

    @Override
    public long count() {
        return (long) counter.get();
    }
}
