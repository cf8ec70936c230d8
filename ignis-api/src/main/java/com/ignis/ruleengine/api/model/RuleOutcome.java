/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Payload a rule returns verbatim when it fires.
 */
public record RuleOutcome(
        @JsonProperty("risk") String risk,
        @JsonProperty("action") String action
) {
    public RuleOutcome {
        Objects.requireNonNull(risk, "Risk cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
    }
}
