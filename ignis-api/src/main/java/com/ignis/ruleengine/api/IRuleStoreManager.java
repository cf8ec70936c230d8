/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api;

import com.ignis.ruleengine.api.model.RuleStore;

import java.io.IOException;

/**
 * Contract for managing the rule store lifecycle (reload and hot reload).
 *
 * <p>Reloading builds a complete new store and publishes it atomically; evaluators
 * created earlier keep using the store they were built with.
 */
public interface IRuleStoreManager {

    /**
     * Starts watching the rule source for changes.
     */
    void start();

    /**
     * Stops watching and releases resources.
     */
    void shutdown();

    /**
     * Gets the currently published rule store.
     *
     * @return current rule store (thread-safe)
     */
    RuleStore getRuleStore();

    /**
     * Reloads the rule source and publishes the result.
     * On failure the previously published store stays active.
     *
     * @return the newly published store
     * @throws IOException if the source cannot be read
     */
    RuleStore reload() throws IOException;

    /**
     * Creates an evaluator bound to the currently published store.
     */
    IRuleEvaluator evaluator();
}
