/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.exceptions;

/**
 * A rule in a well-formed source is missing a required field or uses an
 * unrecognized operator.
 *
 * <p>Identifies the rule by its position in the source and, when present, its id,
 * plus the path of the offending field (for example {@code conditions[1].operator}).
 */
public class InvalidRuleException extends RuleLoadException {

    private final int ruleIndex;
    private final String ruleId;
    private final String field;

    public InvalidRuleException(String source, int ruleIndex, String ruleId, String field, String message) {
        super(source, describe(ruleIndex, ruleId, field, message));
        this.ruleIndex = ruleIndex;
        this.ruleId = ruleId;
        this.field = field;
    }

    public InvalidRuleException(String source, int ruleIndex, String ruleId, String field, String message,
                                Throwable cause) {
        super(source, describe(ruleIndex, ruleId, field, message), cause);
        this.ruleIndex = ruleIndex;
        this.ruleId = ruleId;
        this.field = field;
    }

    /**
     * Zero-based position of the rule in the source, or -1 if the error concerns the whole rule set.
     */
    public int getRuleIndex() {
        return ruleIndex;
    }

    /**
     * Id of the offending rule, or null if it has none.
     */
    public String getRuleId() {
        return ruleId;
    }

    /**
     * Path of the offending field within the rule, or null.
     */
    public String getField() {
        return field;
    }

    private static String describe(int ruleIndex, String ruleId, String field, String message) {
        StringBuilder sb = new StringBuilder();
        if (ruleIndex >= 0) {
            sb.append("Rule at index ").append(ruleIndex);
            if (ruleId != null) {
                sb.append(" ('").append(ruleId).append("')");
            }
            if (field != null) {
                sb.append(", field '").append(field).append('\'');
            }
            sb.append(": ");
        }
        return sb.append(message).toString();
    }
}
