package com.ignis.ruleengine.runtime.evaluation;

import com.ignis.ruleengine.api.IRuleEvaluator;
import com.ignis.ruleengine.api.model.EvaluationResult;
import com.ignis.ruleengine.api.model.Record;
import com.ignis.ruleengine.api.model.Rule;
import com.ignis.ruleengine.api.model.RuleStore;
import com.ignis.ruleengine.infra.metrics.Counter;
import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.ignis.ruleengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * First-match evaluator over an immutable {@link RuleStore}.
 *
 * <p>Rules are scanned in store order (ascending priority, ties in declaration
 * order). Within a rule, conditions are checked in declared order and the scan of
 * that rule stops at the first failing condition. The first rule whose conditions
 * all hold short-circuits the scan.
 *
 * <p>The evaluator keeps no per-call state, so one instance can serve any number
 * of threads. It never throws for record content: a record that matches nothing,
 * whether for lack of data or otherwise, yields {@link EvaluationResult#DEFAULT}.
 */
public final class RuleEvaluator implements IRuleEvaluator {
    private static final Logger logger = Logger.getLogger(RuleEvaluator.class.getName());

    private final RuleStore ruleStore;
    private final List<Rule> rules;
    private final MetricsRegistry metrics;
    private final Counter evaluatedCounter;
    private final Counter unmatchedCounter;
    private final Timer evaluationTimer;

    public RuleEvaluator(RuleStore ruleStore) {
        this(ruleStore, MetricsRegistry.getInstance());
    }

    public RuleEvaluator(RuleStore ruleStore, MetricsRegistry metrics) {
        this.ruleStore = Objects.requireNonNull(ruleStore, "Rule store cannot be null");
        this.rules = ruleStore.rules();
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry cannot be null");
        this.evaluatedCounter = metrics.counter("records_evaluated");
        this.unmatchedCounter = metrics.counter("records_unmatched");
        this.evaluationTimer = metrics.timer("record_evaluation");
    }

    @Override
    public EvaluationResult evaluate(Record record) {
        Objects.requireNonNull(record, "Record cannot be null");
        long startNanos = System.nanoTime();
        try {
            for (Rule rule : rules) {
                if (rule.matches(record)) {
                    metrics.counter("rule_matches", "rule_id", rule.id()).increment();
                    return EvaluationResult.of(rule);
                }
            }
            unmatchedCounter.increment();
            if (logger.isLoggable(Level.FINEST)) {
                logger.finest("No rule matched " + record);
            }
            return EvaluationResult.DEFAULT;
        } finally {
            evaluatedCounter.increment();
            evaluationTimer.record(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public RuleStore getRuleStore() {
        return ruleStore;
    }
}
