/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api;

import com.ignis.ruleengine.api.model.EvaluationResult;
import com.ignis.ruleengine.api.model.Record;
import com.ignis.ruleengine.api.model.RuleStore;

import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Contract for classifying records against a loaded rule set.
 *
 * <p>The first rule (in store order) whose conditions all hold determines the
 * result. When none matches, {@link EvaluationResult#DEFAULT} is returned.
 * Evaluation never fails because of record content: missing fields and kind
 * mismatches just make a condition fail.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RuleStore store = loader.load(Path.of("rules.json"));
 * IRuleEvaluator evaluator = new RuleEvaluator(store);
 *
 * EvaluationResult result = evaluator.evaluate(MapRecord.of(Map.of(
 *     "temperature", 42,
 *     "humidity", 18
 * )));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe; the same instance may classify
 * independent records from multiple threads.
 */
public interface IRuleEvaluator {

    /**
     * Classifies a single record.
     *
     * @param record the record to evaluate (must not be null)
     * @return the matched rule's result, or the default result
     * @throws NullPointerException if record is null
     */
    EvaluationResult evaluate(Record record);

    /**
     * Classifies a sequence of records lazily.
     *
     * <p>The returned stream has one result per input record, in input order,
     * and like any stream can be consumed only once.
     */
    default Stream<EvaluationResult> evaluateBatch(Stream<? extends Record> records) {
        return records.map(this::evaluate);
    }

    /**
     * Classifies a finite collection of records lazily, preserving order.
     */
    default Stream<EvaluationResult> evaluateBatch(Iterable<? extends Record> records) {
        return evaluateBatch(StreamSupport.stream(records.spliterator(), false));
    }

    /**
     * The rule set this evaluator is bound to.
     */
    RuleStore getRuleStore();
}
