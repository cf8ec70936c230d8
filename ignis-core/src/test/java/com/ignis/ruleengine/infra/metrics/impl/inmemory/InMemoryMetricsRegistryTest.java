package com.ignis.ruleengine.infra.metrics.impl.inmemory;

import com.ignis.ruleengine.infra.metrics.Counter;
import com.ignis.ruleengine.infra.metrics.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMetricsRegistryTest {

    private InMemoryMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryMetricsRegistry();
    }

    @Test
    void sameNameAndTagsShareCounter() {
        Counter first = registry.counter("rule_matches", "rule_id", "A");
        Counter second = registry.counter("rule_matches", "rule_id", "A");

        first.increment();
        second.increment(2);

        assertThat(first).isSameAs(second);
        assertThat(registry.getCounterValue("rule_matches", "rule_id", "A")).isEqualTo(3L);
    }

    @Test
    void tagsSeparateCounters() {
        registry.counter("rule_matches", "rule_id", "A").increment();
        registry.counter("rule_matches", "rule_id", "B").increment(5);

        assertThat(registry.getCounterValue("rule_matches", "rule_id", "A")).isEqualTo(1L);
        assertThat(registry.getCounterValue("rule_matches", "rule_id", "B")).isEqualTo(5L);
        assertThat(registry.getCounterValue("rule_matches")).isZero();
    }

    @Test
    void unknownCounterReadsZero() {
        assertThat(registry.getCounterValue("never_created")).isZero();
        assertThat(registry.getTimerRecordings("never_created")).isEmpty();
    }

    @Test
    void counterRejectsNegativeIncrement() {
        Counter counter = registry.counter("records_evaluated");

        assertThatThrownBy(() -> counter.increment(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void timerKeepsRecordings() {
        Timer timer = registry.timer("record_evaluation");

        timer.record(Duration.ofNanos(1_500));
        timer.record(Duration.ofMillis(2));

        assertThat(timer.count()).isEqualTo(2L);
        assertThat(registry.getTimerRecordings("record_evaluation"))
                .containsExactly(Duration.ofNanos(1_500), Duration.ofMillis(2));
        assertThatThrownBy(() -> timer.record(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetClearsEverything() {
        registry.counter("records_evaluated").increment();
        registry.timer("record_evaluation").record(Duration.ofMillis(1));

        registry.reset();

        assertThat(registry.getCounterValue("records_evaluated")).isZero();
        assertThat(registry.getTimerRecordings("record_evaluation")).isEmpty();
    }

    @Test
    void keyRendersTags() {
        assertThat(InMemoryMetricsRegistry.key("http_requests")).isEqualTo("http_requests");
        assertThat(InMemoryMetricsRegistry.key("rule_store_reloads", "outcome", "success"))
                .isEqualTo("rule_store_reloads{outcome=success}");
    }
}
