/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import java.util.Objects;

/**
 * One atomic comparison of a record field against a rule operand.
 *
 * @param field     record attribute to read
 * @param operator  comparison, resolved from its symbol at load time
 * @param value     operand declared by the rule (number or string)
 * @param valueKind kind of {@code value}, tagged at load time
 */
public record Condition(
        String field,
        Operator operator,
        Object value,
        ValueKind valueKind
) {

    public Condition {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(value, "Value cannot be null for operator " + operator);
        Objects.requireNonNull(valueKind, "Value must be a number or a string: " + value);
    }

    /**
     * Creates a condition, tagging the operand kind from its runtime type.
     */
    public static Condition of(String field, Operator operator, Object value) {
        return new Condition(field, operator, value, ValueKind.of(value));
    }

    /**
     * Returns true if the record carries {@link #field()} and the comparison holds.
     * A missing field or a kind mismatch simply fails the condition.
     */
    public boolean holds(Record record) {
        Object actual = record.get(field);
        if (actual == null) {
            return false;
        }
        return operator.test(actual, value, valueKind);
    }

    @Override
    public String toString() {
        return field + " " + operator.symbol() + " " + (valueKind == ValueKind.STRING ? "'" + value + "'" : value);
    }
}
