/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, priority-ordered collection of loaded rules.
 *
 * <p>Rules are kept in evaluation order: ascending priority, ties in declaration
 * order. A store is never modified after construction; reloading builds a new one.
 */
public final class RuleStore {

    private final List<Rule> rules;
    private final String source;
    private final Instant loadedAt;

    /**
     * @param rules    rules already in evaluation order
     * @param source   name of the source the rules were read from
     * @param loadedAt when the load completed
     */
    public RuleStore(List<Rule> rules, String source, Instant loadedAt) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules cannot be null"));
        this.source = source;
        this.loadedAt = Objects.requireNonNull(loadedAt, "Load time cannot be null");
    }

    @JsonProperty("rules")
    public List<Rule> rules() {
        return rules;
    }

    @JsonProperty("source")
    public String source() {
        return source;
    }

    @JsonProperty("loaded_at")
    public String loadedAtIso() {
        return loadedAt.toString();
    }

    @JsonIgnore
    public Instant loadedAt() {
        return loadedAt;
    }

    @JsonProperty("rule_count")
    public int size() {
        return rules.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "RuleStore[source=" + source + ", rules=" + rules.size() + ", loadedAt=" + loadedAt + "]";
    }
}
