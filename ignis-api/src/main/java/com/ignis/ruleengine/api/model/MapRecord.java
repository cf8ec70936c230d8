/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable {@link Record} backed by an insertion-ordered copy of its attributes.
 * Entries with a null value are dropped, so they read as absent fields.
 */
public final class MapRecord implements Record {

    private final Map<String, Object> attributes;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public MapRecord(Map<String, Object> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        this.attributes = Collections.unmodifiableMap(copy);
    }

    public static MapRecord of(Map<String, Object> attributes) {
        return new MapRecord(attributes);
    }

    @Override
    public Object get(String field) {
        return attributes.get(field);
    }

    @Override
    public Set<String> fields() {
        return attributes.keySet();
    }

    @JsonValue
    @Override
    public Map<String, Object> asMap() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MapRecord)) return false;
        return attributes.equals(((MapRecord) o).attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "MapRecord" + attributes;
    }
}
