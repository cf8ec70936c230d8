/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.exceptions;

/**
 * The source exists but cannot be parsed into the expected structure.
 */
public class MalformedSourceException extends RuleLoadException {

    public MalformedSourceException(String source, String message) {
        super(source, "Malformed source '" + source + "': " + message);
    }

    public MalformedSourceException(String source, String message, Throwable cause) {
        super(source, "Malformed source '" + source + "': " + message, cause);
    }
}
