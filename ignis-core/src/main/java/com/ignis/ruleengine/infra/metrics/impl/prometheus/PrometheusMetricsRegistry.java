package com.ignis.ruleengine.infra.metrics.impl.prometheus;

import com.ignis.ruleengine.infra.metrics.Counter;
import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.ignis.ruleengine.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus simpleclient implementation of {@link MetricsRegistry}.
 *
 * <p>One collector is registered per metric name; each distinct set of label
 * values gets its own child. The label names used the first time a metric is
 * requested are fixed for its lifetime.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] LATENCY_BUCKETS =
            {0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0};

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        io.prometheus.client.Counter counter = counters.computeIfAbsent(name, n ->
                io.prometheus.client.Counter.build()
                        .name(sanitizeName(n))
                        .help("Ignis counter " + n)
                        .labelNames(labelNames(tags))
                        .register(registry));
        return new PrometheusCounterAdapter(counter, labelValues(tags));
    }

    @Override
    public Timer timer(String name, String... tags) {
        Histogram histogram = histograms.computeIfAbsent(name, n ->
                Histogram.build()
                        .name(sanitizeName(n) + "_seconds")
                        .help("Ignis timer " + n)
                        .buckets(LATENCY_BUCKETS)
                        .labelNames(labelNames(tags))
                        .register(registry));
        return new PrometheusTimerAdapter(histogram, labelValues(tags));
    }

    CollectorRegistry getCollectorRegistry() {
        return registry;
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String[] labelNames(String[] tags) {
        String[] names = new String[tags.length / 2];
        for (int i = 0; i < names.length; i++) {
            names[i] = tags[i * 2];
        }
        return names;
    }

    private static String[] labelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}
