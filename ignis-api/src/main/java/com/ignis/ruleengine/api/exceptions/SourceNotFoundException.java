/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.exceptions;

/**
 * The rule-set or record source does not exist.
 */
public class SourceNotFoundException extends RuleLoadException {

    public SourceNotFoundException(String source) {
        super(source, "Source not found: " + source);
    }

    public SourceNotFoundException(String source, Throwable cause) {
        super(source, "Source not found: " + source, cause);
    }
}
