/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import java.util.Map;
import java.util.Set;

/**
 * One input observation to classify: a read-only mapping from field name to value.
 *
 * <p>The engine has no fixed schema; it only reads the fields rules reference.
 * Values are expected to be numbers or strings.
 */
public interface Record {

    /**
     * Reads a field.
     *
     * @param field attribute name
     * @return the value, or null if the record does not carry the field
     */
    Object get(String field);

    /**
     * Names of the fields this record carries, in source order.
     */
    Set<String> fields();

    /**
     * Read-only view of all attributes.
     */
    Map<String, Object> asMap();
}
