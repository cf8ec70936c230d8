package com.ignis.ruleengine;

import com.ignis.ruleengine.api.exceptions.RuleLoadException;
import com.ignis.ruleengine.api.model.EvaluationResult;
import com.ignis.ruleengine.api.model.Record;
import com.ignis.ruleengine.api.model.RuleStore;
import com.ignis.ruleengine.config.EngineConfig;
import com.ignis.ruleengine.infra.management.RuleStoreManager;
import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.ignis.ruleengine.infra.telemetry.TracingService;
import com.ignis.ruleengine.io.AnnotatedRecordWriter;
import com.ignis.ruleengine.io.CsvRecordReader;
import com.ignis.ruleengine.loader.RuleLoader;
import com.ignis.ruleengine.runtime.evaluation.PartitionedBatchEvaluator;
import com.ignis.ruleengine.runtime.evaluation.RuleEvaluator;
import com.ignis.ruleengine.server.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point.
 *
 * <pre>
 * evaluate &lt;records.csv&gt; [annotated.csv]   classify a CSV file once and exit
 * serve                                   run the HTTP server with hot reload
 * </pre>
 *
 * The rule file and other settings come from {@link EngineConfig}.
 */
public class RuleEngineApplication {
    private static final Logger logger = Logger.getLogger(RuleEngineApplication.class.getName());

    private final EngineConfig config;
    private HttpServer httpServer;
    private RuleStoreManager storeManager;

    RuleEngineApplication(EngineConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        configureLogging();
        if (args.length == 0) {
            usage();
            System.exit(2);
        }
        RuleEngineApplication app = new RuleEngineApplication(EngineConfig.fromEnvironment());
        try {
            switch (args[0]) {
                case "evaluate" -> {
                    if (args.length < 2) {
                        usage();
                        System.exit(2);
                    }
                    Path output = args.length > 2 ? Path.of(args[2]) : null;
                    app.evaluateFile(Path.of(args[1]), output);
                }
                case "serve" -> {
                    app.serve();
                    Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
                    Thread.currentThread().join();
                }
                default -> {
                    usage();
                    System.exit(2);
                }
            }
        } catch (RuleLoadException e) {
            logger.log(Level.SEVERE, "Cannot load rules: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Application failed: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Classifies every record of a CSV file and logs how many records got each risk label.
     *
     * @param output where to write the annotated CSV, or {@code null} to skip it
     * @return the per-risk-label counts
     */
    Map<String, Long> evaluateFile(Path input, Path output) throws IOException {
        RuleStore store = new RuleLoader().load(config.rulesFile());
        List<Record> records = new CsvRecordReader().read(input);

        List<EvaluationResult> results;
        try (PartitionedBatchEvaluator batch = new PartitionedBatchEvaluator(
                new RuleEvaluator(store), config.batchParallelism())) {
            results = batch.evaluateAll(records);
        }

        Map<String, Long> countsByRisk = new TreeMap<>();
        results.forEach(r -> countsByRisk.merge(r.risk(), 1L, Long::sum));
        countsByRisk.forEach((risk, count) -> logger.info(String.format("%-10s %d", risk, count)));

        if (output != null) {
            new AnnotatedRecordWriter().write(output, records, results);
            logger.info("Annotated records written to " + output);
        }
        return countsByRisk;
    }

    void serve() throws IOException {
        logger.info("Starting Ignis rule engine");
        TracingService tracingService = TracingService.getInstance();
        MetricsRegistry metrics = MetricsRegistry.getInstance();

        storeManager = new RuleStoreManager(config.rulesFile(), new RuleLoader(tracingService.getTracer()),
                tracingService.getTracer(), metrics, config.reloadIntervalSeconds());
        storeManager.start();

        httpServer = new HttpServer(config.serverPort(), storeManager, tracingService.getTracer(), metrics);
        httpServer.start();
        logger.info("Rule engine is ready to serve requests on port " + httpServer.getPort());
    }

    void shutdown() {
        if (storeManager != null) storeManager.shutdown();
        if (httpServer != null) httpServer.stop();
        logger.info("Rule engine shutdown complete");
    }

    private static void usage() {
        logger.severe("Usage: evaluate <records.csv> [annotated.csv] | serve");
    }

    private static void configureLogging() {
        try (InputStream config = RuleEngineApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, using JDK defaults", e);
        }
    }
}
