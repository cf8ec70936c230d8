package com.ignis.ruleengine.infra.metrics.impl.inmemory;

import com.ignis.ruleengine.infra.metrics.Counter;
import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.ignis.ruleengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for tests.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * RuleEvaluator evaluator = new RuleEvaluator(store, metrics);
 * evaluator.evaluate(record);
 * assertThat(metrics.getCounterValue("records_evaluated")).isEqualTo(1L);
 * }</pre>
 *
 * Metrics are keyed by name plus tags, rendered as {@code name{k=v,...}}.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    public long getCounterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.recordings() : List.of();
    }

    public void reset() {
        counters.clear();
        timers.clear();
    }

    static String key(String name, String... tags) {
        if (tags.length == 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        for (int i = 0; i + 1 < tags.length; i += 2) {
            if (i > 0) sb.append(',');
            sb.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return sb.append('}').toString();
    }
}
