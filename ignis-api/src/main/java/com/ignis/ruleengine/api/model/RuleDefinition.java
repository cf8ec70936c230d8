/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a rule for deserialization.
 * This is a plain DTO used only while loading; every field may be null here
 * and is checked by the loader.
 *
 * <p>Portuguese keys of older rule files ({@code prioridade}, {@code condicoes},
 * {@code variavel}, {@code operador}, {@code valor}, {@code resultado},
 * {@code risco}, {@code acao}) are accepted as aliases.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("priority") @JsonAlias("prioridade") Integer priority,
        @JsonProperty("description") @JsonAlias("descricao") String description,
        @JsonProperty("conditions") @JsonAlias("condicoes") List<ConditionDefinition> conditions,
        @JsonProperty("result") @JsonAlias("resultado") ResultDefinition result
) {

    /**
     * DTO for a single condition.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConditionDefinition(
            @JsonProperty("field") @JsonAlias("variavel") String field,
            @JsonProperty("operator") @JsonAlias("operador") String operator,
            @JsonProperty("value") @JsonAlias("valor") Object value
    ) {}

    /**
     * DTO for the result payload.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResultDefinition(
            @JsonProperty("risk") @JsonAlias("risco") String risk,
            @JsonProperty("action") @JsonAlias("acao") String action
    ) {}
}
