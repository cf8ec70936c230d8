package com.ignis.ruleengine.infra.metrics.api;

import com.ignis.ruleengine.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations need a public no-arg constructor and are registered in
 * {@code META-INF/services/com.ignis.ruleengine.infra.metrics.api.MetricsRegistryProvider}.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    /**
     * Higher values are preferred when multiple providers exist.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
