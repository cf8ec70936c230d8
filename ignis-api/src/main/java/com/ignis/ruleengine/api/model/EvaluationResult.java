/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of classifying one record.
 *
 * <p>When no rule fires the result is {@link #DEFAULT}: risk {@code NORMAL},
 * action {@code routine monitoring}, matched rule {@link #NO_RULE}.
 */
public record EvaluationResult(
        @JsonProperty("risk") String risk,
        @JsonProperty("action") String action,
        @JsonProperty("matched_rule_id") String matchedRuleId
) implements Serializable {

    public static final String NO_RULE = "NO_RULE";
    public static final String NORMAL_RISK = "NORMAL";
    public static final String ROUTINE_ACTION = "routine monitoring";

    public static final EvaluationResult DEFAULT =
            new EvaluationResult(NORMAL_RISK, ROUTINE_ACTION, NO_RULE);

    public EvaluationResult {
        Objects.requireNonNull(risk, "Risk cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        Objects.requireNonNull(matchedRuleId, "Matched rule id cannot be null");
    }

    /**
     * Result carrying a fired rule's outcome and id.
     */
    public static EvaluationResult of(Rule rule) {
        return new EvaluationResult(rule.outcome().risk(), rule.outcome().action(), rule.id());
    }

    /**
     * Returns true if a rule fired, false for the fail-open default.
     */
    @JsonIgnore
    public boolean isMatched() {
        return !NO_RULE.equals(matchedRuleId);
    }
}
