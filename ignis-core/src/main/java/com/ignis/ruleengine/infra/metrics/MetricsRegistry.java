package com.ignis.ruleengine.infra.metrics;

import com.ignis.ruleengine.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; see
 * {@link com.ignis.ruleengine.infra.metrics.api.MetricsRegistryProvider}.
 *
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("rule_matches", "rule_id", "FIRE_CRITICAL_01").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags alternating label names and values
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a timer.
     *
     * @param name metric name
     * @param tags alternating label names and values
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry. Falls back to a no-op registry if no provider is found.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
