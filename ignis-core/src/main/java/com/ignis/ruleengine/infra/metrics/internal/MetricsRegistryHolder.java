package com.ignis.ruleengine.infra.metrics.internal;

import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.ignis.ruleengine.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the singleton {@link MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b>
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE = load();

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    private static MetricsRegistry load() {
        ServiceLoader<MetricsRegistryProvider> loader = ServiceLoader.load(MetricsRegistryProvider.class);
        MetricsRegistryProvider provider = StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider == null) {
            logger.info("No metrics provider found, using no-op implementation");
            return new NoOpMetricsRegistry();
        }
        logger.info(String.format("Using metrics provider: %s (priority: %d)", provider.name(), provider.priority()));
        return provider.create();
    }
}
