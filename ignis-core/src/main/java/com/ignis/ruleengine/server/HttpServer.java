package com.ignis.ruleengine.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.ignis.ruleengine.api.IRuleEvaluator;
import com.ignis.ruleengine.api.IRuleStoreManager;
import com.ignis.ruleengine.api.exceptions.RuleLoadException;
import com.ignis.ruleengine.api.model.EvaluationResult;
import com.ignis.ruleengine.api.model.MapRecord;
import com.ignis.ruleengine.api.model.RuleStore;
import com.ignis.ruleengine.infra.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * JSON-over-HTTP boundary of the engine, built on the JDK's {@code com.sun.net.httpserver}.
 *
 * <ul>
 *   <li>{@code POST /evaluate} - one record (JSON object) in, one result out</li>
 *   <li>{@code POST /evaluate/batch} - JSON array of records in, results in the same order out</li>
 *   <li>{@code GET /rules} - the active rule store in evaluation order</li>
 *   <li>{@code POST /rules/reload} - reload the rule file; 422 if the new rule set is rejected</li>
 *   <li>{@code GET /health} - liveness and active rule count</li>
 * </ul>
 *
 * Each request resolves the evaluator from the manager, so a reload takes effect
 * on the next request while requests in flight finish on the store they started with.
 */
public class HttpServer {
    private static final Logger logger = Logger.getLogger(HttpServer.class.getName());
    private static final TypeReference<List<MapRecord>> RECORD_LIST = new TypeReference<>() {};

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final IRuleStoreManager storeManager;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Tracer tracer;
    private final MetricsRegistry metrics;

    public HttpServer(int port, IRuleStoreManager storeManager, Tracer tracer, MetricsRegistry metrics)
            throws IOException {
        this.storeManager = storeManager;
        this.tracer = tracer;
        this.metrics = metrics;
        this.executor = Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors() * 2,
                new ThreadFactoryBuilder().setNameFormat("ignis-http-%d").setDaemon(true).build());
        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 100);
        server.createContext("/evaluate", new JsonHandler("POST", "/evaluate", this::evaluateOne));
        server.createContext("/evaluate/batch", new JsonHandler("POST", "/evaluate/batch", this::evaluateBatch));
        server.createContext("/rules", new JsonHandler("GET", "/rules", exchange -> storeManager.getRuleStore()));
        server.createContext("/rules/reload", new JsonHandler("POST", "/rules/reload", this::reload));
        server.createContext("/health", new JsonHandler("GET", "/health", exchange -> health()));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("HTTP server listening on port " + getPort());
    }

    public void stop() {
        server.stop(0);
        executor.shutdown();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    private Object evaluateOne(HttpExchange exchange) throws IOException {
        MapRecord record = objectMapper.readValue(exchange.getRequestBody(), MapRecord.class);
        if (record == null) {
            throw new HttpError(400, "Request body must be a JSON object", null);
        }
        return storeManager.evaluator().evaluate(record);
    }

    private Object evaluateBatch(HttpExchange exchange) throws IOException {
        List<MapRecord> records = objectMapper.readValue(exchange.getRequestBody(), RECORD_LIST);
        if (records == null) {
            throw new HttpError(400, "Request body must be a JSON array of objects", null);
        }
        int nullIndex = records.indexOf(null);
        if (nullIndex >= 0) {
            throw new HttpError(400, "Record at index " + nullIndex + " must be a JSON object", null);
        }
        IRuleEvaluator evaluator = storeManager.evaluator();
        List<EvaluationResult> results = evaluator.evaluateBatch(records).collect(Collectors.toList());
        Span.current().setAttribute("recordCount", results.size());
        return results;
    }

    private Object reload(HttpExchange exchange) throws IOException {
        try {
            RuleStore store = storeManager.reload();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "reloaded");
            body.put("rules", store.size());
            return body;
        } catch (RuleLoadException e) {
            throw new HttpError(422, e.getMessage(), e);
        }
    }

    private Object health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("rules", storeManager.getRuleStore().size());
        return body;
    }

    @FunctionalInterface
    private interface Route {
        Object handle(HttpExchange exchange) throws IOException;
    }

    private static final class HttpError extends RuntimeException {
        private final int status;

        HttpError(int status, String message, Throwable cause) {
            super(message, cause);
            this.status = status;
        }
    }

    private final class JsonHandler implements HttpHandler {
        private final String method;
        private final String path;
        private final Route route;

        JsonHandler(String method, String path, Route route) {
            this.method = method;
            this.path = path;
            this.route = route;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Span span = tracer.spanBuilder(method + " " + path).startSpan();
            try (Scope scope = span.makeCurrent()) {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    sendResponse(exchange, 404, Map.of("error", "Not found"));
                    return;
                }
                if (!method.equals(exchange.getRequestMethod())) {
                    sendResponse(exchange, 405, Map.of("error", "Method not allowed"));
                    return;
                }
                metrics.counter("http_requests", "path", path).increment();
                sendResponse(exchange, 200, route.handle(exchange));
            } catch (JsonProcessingException e) {
                span.recordException(e);
                sendResponse(exchange, 400, Map.of("error", "Invalid JSON body: " + e.getOriginalMessage()));
            } catch (HttpError e) {
                span.recordException(e);
                sendResponse(exchange, e.status, Map.of("error", String.valueOf(e.getMessage())));
            } catch (IOException | RuntimeException e) {
                span.recordException(e);
                logger.log(Level.WARNING, "Request " + method + " " + path + " failed", e);
                sendResponse(exchange, 500, Map.of("error", String.valueOf(e.getMessage())));
            } finally {
                span.end();
                exchange.close();
            }
        }
    }

    private void sendResponse(HttpExchange exchange, int statusCode, Object response) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(response);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
