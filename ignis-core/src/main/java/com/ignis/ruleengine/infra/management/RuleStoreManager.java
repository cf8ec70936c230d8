package com.ignis.ruleengine.infra.management;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.ignis.ruleengine.api.IRuleEvaluator;
import com.ignis.ruleengine.api.IRuleLoader;
import com.ignis.ruleengine.api.IRuleStoreManager;
import com.ignis.ruleengine.api.exceptions.RuleLoadException;
import com.ignis.ruleengine.api.model.RuleStore;
import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.ignis.ruleengine.runtime.evaluation.RuleEvaluator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the published {@link RuleStore} and replaces it when the rule file changes.
 *
 * <p>A reload builds a complete new store and swaps the reference in one atomic
 * step. Readers never lock: they see either the old or the new store, and an
 * evaluator created before the swap keeps the store it was built with until it
 * is discarded. If a reload fails, the previous store stays published.
 */
public class RuleStoreManager implements IRuleStoreManager {
    private static final Logger logger = Logger.getLogger(RuleStoreManager.class.getName());

    private final Path rulesPath;
    private final IRuleLoader loader;
    private final Tracer tracer;
    private final MetricsRegistry metrics;
    private final long pollIntervalSeconds;

    private final AtomicReference<RuleStore> activeStore = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;

    /**
     * Loads the initial rule store. Fails fast: a load error propagates and no
     * manager is created.
     *
     * @throws RuleLoadException if the rule file is missing, malformed or invalid
     * @throws IOException       if the rule file cannot be read
     */
    public RuleStoreManager(Path rulesPath, IRuleLoader loader, Tracer tracer, MetricsRegistry metrics,
                            long pollIntervalSeconds) throws IOException {
        this.rulesPath = rulesPath;
        this.loader = loader;
        this.tracer = tracer;
        this.metrics = metrics;
        this.pollIntervalSeconds = pollIntervalSeconds;
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("rule-file-monitor")
                .setDaemon(true)
                .build());

        reload();
    }

    @Override
    public RuleStore getRuleStore() {
        return activeStore.get();
    }

    @Override
    public IRuleEvaluator evaluator() {
        return new RuleEvaluator(activeStore.get(), metrics);
    }

    @Override
    public void start() {
        monitoringExecutor.scheduleWithFixedDelay(this::checkForUpdates,
                pollIntervalSeconds, pollIntervalSeconds, TimeUnit.SECONDS);
        logger.info(String.format("Watching '%s' for changes every %d s", rulesPath, pollIntervalSeconds));
    }

    @Override
    public void shutdown() {
        monitoringExecutor.shutdownNow();
    }

    @Override
    public synchronized RuleStore reload() throws IOException {
        Span span = tracer.spanBuilder("reload-rule-store").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFile", rulesPath.toString());
            long modifiedTime = Files.exists(rulesPath) ? Files.getLastModifiedTime(rulesPath).toMillis() : -1;

            RuleStore newStore = loader.load(rulesPath);
            RuleStore previous = activeStore.getAndSet(newStore);
            lastModifiedTime = modifiedTime;

            span.setAttribute("ruleCount", newStore.size());
            metrics.counter("rule_store_reloads", "outcome", "success").increment();
            if (previous != null) {
                logger.info(String.format("Swapped rule store: %d -> %d rules", previous.size(), newStore.size()));
            }
            return newStore;
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            metrics.counter("rule_store_reloads", "outcome", "failure").increment();
            throw e;
        } finally {
            span.end();
        }
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-rule-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long currentModifiedTime = Files.getLastModifiedTime(rulesPath).toMillis();
            if (currentModifiedTime != lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in rule file. Attempting to reload...");
                reload();
            }
        } catch (RuleLoadException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "Failed to load new rule set. Previous rules remain active: " + e.getMessage());
            // Do not retry the same broken file on every poll.
            rememberModifiedTime();
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check rule file for modifications.", e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "Unexpected error during rule reload check.", e);
        } finally {
            span.end();
        }
    }

    private void rememberModifiedTime() {
        try {
            lastModifiedTime = Files.getLastModifiedTime(rulesPath).toMillis();
        } catch (IOException e) {
            logger.log(Level.FINE, "Rule file disappeared while recording its modification time", e);
        }
    }
}
