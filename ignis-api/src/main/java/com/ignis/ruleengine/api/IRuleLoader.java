/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api;

import com.ignis.ruleengine.api.model.RuleStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Contract for loading a JSON rule set into an ordered, validated {@link RuleStore}.
 *
 * <p>Failures are reported as distinguishable kinds:
 * <ul>
 *   <li>{@link com.ignis.ruleengine.api.exceptions.SourceNotFoundException} - the source does not exist</li>
 *   <li>{@link com.ignis.ruleengine.api.exceptions.MalformedSourceException} - not parseable as a JSON array</li>
 *   <li>{@link com.ignis.ruleengine.api.exceptions.InvalidRuleException} - a rule is missing a required
 *       field or uses an unrecognized operator</li>
 * </ul>
 * A loader never returns an empty store.
 */
public interface IRuleLoader {

    /**
     * Loads rules from a JSON file.
     *
     * @param rulesPath path to the JSON rules file
     * @return rules in evaluation order (ascending priority, ties in file order)
     * @throws IOException if the file exists but cannot be read
     */
    RuleStore load(Path rulesPath) throws IOException;

    /**
     * Loads rules from a stream. The stream is read fully but not closed.
     *
     * @param in         JSON document
     * @param sourceName name used in errors and on the resulting store
     * @return rules in evaluation order
     * @throws IOException if the stream cannot be read
     */
    RuleStore load(InputStream in, String sourceName) throws IOException;
}
