/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

/**
 * Runtime kind of a comparison operand or record value.
 */
public enum ValueKind {
    NUMERIC,
    STRING;

    /**
     * Classifies a value.
     *
     * @param value any object, possibly null
     * @return the kind, or null if the value is neither a number nor a string
     */
    public static ValueKind of(Object value) {
        if (value instanceof Number) {
            return NUMERIC;
        }
        if (value instanceof String) {
            return STRING;
        }
        return null;
    }
}
