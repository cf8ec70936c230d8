package com.ignis.ruleengine.infra.metrics.impl.prometheus;

import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.ignis.ruleengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed provider, registered through {@code META-INF/services}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
