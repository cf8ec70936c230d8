package com.ignis.ruleengine.infra.metrics.impl.prometheus;

import com.ignis.ruleengine.infra.metrics.Timer;

import java.time.Duration;

/**
 * Binds an Ignis {@link Timer} to a Prometheus histogram recorded in seconds.
 * Percentiles are left to PromQL ({@code histogram_quantile}).
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public long count() {
        // Buckets are cumulative; the last one (+Inf) holds the total.
        double[] buckets = histogram.get().buckets;
        return buckets.length == 0 ? 0L : (long) buckets[buckets.length - 1];
    }
}
