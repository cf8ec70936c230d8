/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A named, prioritized decision unit.
 *
 * <p>Conditions are combined with logical AND and evaluated in declared order;
 * an empty condition list always matches. Lower {@code priority} values are
 * evaluated first.
 */
public record Rule(
        @JsonProperty("id") String id,
        @JsonProperty("priority") int priority,
        @JsonProperty("description") String description,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("result") RuleOutcome outcome
) {

    public Rule {
        Objects.requireNonNull(id, "Rule id cannot be null");
        Objects.requireNonNull(outcome, "Rule outcome cannot be null");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /**
     * Checks every condition in order, stopping at the first one that fails.
     */
    public boolean matches(Record record) {
        for (Condition condition : conditions) {
            if (!condition.holds(record)) {
                return false;
            }
        }
        return true;
    }
}
