/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.exceptions;

/**
 * Base type for failures while loading a rule set or record source.
 *
 * <p>Unchecked so that callers are not forced to handle it at every layer; load
 * failures are fatal at start-up and are expected to surface to the operator.
 */
public class RuleLoadException extends RuntimeException {

    private final String source;

    public RuleLoadException(String source, String message) {
        super(message);
        this.source = source;
    }

    public RuleLoadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * Name of the source that failed to load (usually a file path).
     */
    public String getSource() {
        return source;
    }
}
