package com.ignis.ruleengine.runtime.evaluation;

import com.ignis.ruleengine.api.IRuleEvaluator;
import com.ignis.ruleengine.api.model.Condition;
import com.ignis.ruleengine.api.model.EvaluationResult;
import com.ignis.ruleengine.api.model.MapRecord;
import com.ignis.ruleengine.api.model.Operator;
import com.ignis.ruleengine.api.model.Record;
import com.ignis.ruleengine.api.model.Rule;
import com.ignis.ruleengine.api.model.RuleOutcome;
import com.ignis.ruleengine.api.model.RuleStore;
import com.ignis.ruleengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PartitionedBatchEvaluatorTest {

    @Mock
    private ExecutorService mockExecutor;

    @Mock
    private IRuleEvaluator failingEvaluator;

    private RuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        List<Rule> rules = List.of(
                new Rule("HOT", 1, null, List.of(Condition.of("temperature", Operator.GREATER_THAN, 35)),
                        new RuleOutcome("MEDIUM", "warn")),
                new Rule("WINDY", 2, null, List.of(Condition.of("wind_speed", Operator.GREATER_THAN, 40)),
                        new RuleOutcome("LOW", "monitor")));
        evaluator = new RuleEvaluator(new RuleStore(rules, "test", Instant.now()), new InMemoryMetricsRegistry());
    }

    /**
     * Record i is HOT when i % 3 == 0, WINDY when i % 3 == 1, unmatched otherwise.
     */
    private static List<Record> records(int count) {
        List<Record> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            switch (i % 3) {
                case 0 -> records.add(MapRecord.of(Map.of("id", i, "temperature", 40)));
                case 1 -> records.add(MapRecord.of(Map.of("id", i, "wind_speed", 60)));
                default -> records.add(MapRecord.of(Map.of("id", i, "temperature", 20)));
            }
        }
        return records;
    }

    private static String expectedRule(int i) {
        return switch (i % 3) {
            case 0 -> "HOT";
            case 1 -> "WINDY";
            default -> EvaluationResult.NO_RULE;
        };
    }

    @Test
    void preservesInputOrderAcrossPartitions() {
        int count = PartitionedBatchEvaluator.MIN_PARTITION_SIZE * 4 * 3 + 17;
        List<Record> records = records(count);

        List<EvaluationResult> results;
        try (PartitionedBatchEvaluator batch = new PartitionedBatchEvaluator(evaluator, 4)) {
            results = batch.evaluateAll(records);
        }

        assertThat(results).hasSize(count);
        for (int i = 0; i < count; i++) {
            assertThat(results.get(i).matchedRuleId()).as("record %d", i).isEqualTo(expectedRule(i));
        }
    }

    @Test
    void matchesSequentialEvaluation() {
        List<Record> records = records(5_000);

        List<EvaluationResult> parallel;
        try (PartitionedBatchEvaluator batch = new PartitionedBatchEvaluator(evaluator, 8)) {
            parallel = batch.evaluateAll(records);
        }
        List<EvaluationResult> sequential = new ArrayList<>();
        records.forEach(r -> sequential.add(evaluator.evaluate(r)));

        assertThat(parallel).containsExactlyElementsOf(sequential);
    }

    @Test
    void smallBatchRunsOnCallingThread() {
        PartitionedBatchEvaluator batch = new PartitionedBatchEvaluator(evaluator, mockExecutor, 4);

        List<EvaluationResult> results = batch.evaluateAll(records(10));

        assertThat(results).hasSize(10);
        verifyNoInteractions(mockExecutor);
    }

    @Test
    void emptyListYieldsEmptyResult() {
        try (PartitionedBatchEvaluator batch = new PartitionedBatchEvaluator(evaluator, 2)) {
            assertThat(batch.evaluateAll(List.of())).isEmpty();
        }
    }

    @Test
    void doesNotShutDownCallerOwnedExecutor() {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            PartitionedBatchEvaluator batch = new PartitionedBatchEvaluator(evaluator, executor, 2);
            batch.evaluateAll(records(PartitionedBatchEvaluator.MIN_PARTITION_SIZE * 2));
            batch.close();

            assertThat(executor.isShutdown()).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void propagatesWorkerFailure() {
        when(failingEvaluator.evaluateBatch(any(Iterable.class))).thenThrow(new IllegalStateException("boom"));

        try (PartitionedBatchEvaluator batch = new PartitionedBatchEvaluator(failingEvaluator, 2)) {
            assertThatThrownBy(() -> batch.evaluateAll(records(PartitionedBatchEvaluator.MIN_PARTITION_SIZE * 2)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("boom");
        }
    }

    @Test
    void rejectsNonPositiveParallelism() {
        assertThatThrownBy(() -> new PartitionedBatchEvaluator(evaluator, mockExecutor, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
