package com.ignis.ruleengine.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ignis.ruleengine.infra.management.RuleStoreManager;
import com.ignis.ruleengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.ignis.ruleengine.loader.RuleLoader;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private Path rulesFile;
    private InMemorySpanExporter spanExporter;
    private InMemoryMetricsRegistry metrics;
    private RuleStoreManager manager;
    private HttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        rulesFile = tempDir.resolve("rules.json");
        try (InputStream in = getClass().getResourceAsStream("/fire-rules.json")) {
            Files.copy(in, rulesFile, StandardCopyOption.REPLACE_EXISTING);
        }
        spanExporter = InMemorySpanExporter.create();
        Tracer tracer = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build()
                .get("test-tracer");
        metrics = new InMemoryMetricsRegistry();
        manager = new RuleStoreManager(rulesFile, new RuleLoader(tracer), tracer, metrics, 60);
        server = new HttpServer(0, manager, tracer, metrics);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        manager.shutdown();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    @Test
    void evaluatesSingleRecord() throws Exception {
        HttpResponse<String> response = post("/evaluate",
                "{\"temperature\": 42, \"humidity\": 18, \"event_type\": \"nenhum\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).contains("application/json");
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("risk").asText()).isEqualTo("CRITICAL");
        assertThat(body.get("action").asText()).isEqualTo("Immediate mobilization.");
        assertThat(body.get("matched_rule_id").asText()).isEqualTo("CRITICAL_01");
        assertThat(metrics.getCounterValue("http_requests", "path", "/evaluate")).isEqualTo(1L);
    }

    @Test
    void unmatchedRecordGetsDefault() throws Exception {
        HttpResponse<String> response = post("/evaluate", "{\"temperature\": 20}");

        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("risk").asText()).isEqualTo("NORMAL");
        assertThat(body.get("matched_rule_id").asText()).isEqualTo("NO_RULE");
    }

    @Test
    void evaluatesBatchInOrder() throws Exception {
        HttpResponse<String> response = post("/evaluate/batch", """
                [
                  {"temperature": 20, "humidity": 50, "event_type": "raio_seco"},
                  {"temperature": 36},
                  {},
                  {"wind_speed": 55.5}
                ]
                """);

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.size()).isEqualTo(4);
        assertThat(body.get(0).get("matched_rule_id").asText()).isEqualTo("HIGH_01");
        assertThat(body.get(1).get("matched_rule_id").asText()).isEqualTo("MEDIUM_01");
        assertThat(body.get(2).get("matched_rule_id").asText()).isEqualTo("NO_RULE");
        assertThat(body.get(3).get("matched_rule_id").asText()).isEqualTo("LOW_01");
    }

    @Test
    void listsRulesInEvaluationOrder() throws Exception {
        HttpResponse<String> response = get("/rules");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("rule_count").asInt()).isEqualTo(5);
        JsonNode rules = body.get("rules");
        assertThat(rules.get(0).get("id").asText()).isEqualTo("CRITICAL_01");
        assertThat(rules.get(1).get("id").asText()).isEqualTo("HIGH_01");
        assertThat(rules.get(2).get("id").asText()).isEqualTo("HIGH_02");
        assertThat(rules.get(0).get("conditions").get(0).get("operator").asText()).isEqualTo(">");
        assertThat(rules.get(0).get("result").get("risk").asText()).isEqualTo("CRITICAL");
    }

    @Test
    void reloadPicksUpNewRules() throws Exception {
        Files.writeString(rulesFile, """
                [{"id": "ONLY", "priority": 1, "conditions": [], "result": {"risk": "LOW", "action": "watch"}}]
                """);

        HttpResponse<String> reload = post("/rules/reload", "");
        assertThat(reload.statusCode()).isEqualTo(200);
        assertThat(objectMapper.readTree(reload.body()).get("rules").asInt()).isEqualTo(1);

        JsonNode result = objectMapper.readTree(post("/evaluate", "{}").body());
        assertThat(result.get("matched_rule_id").asText()).isEqualTo("ONLY");
    }

    @Test
    void rejectedReloadReturns422AndKeepsRules() throws Exception {
        Files.writeString(rulesFile, "[{\"id\": \"BAD\", \"priority\": 1, \"conditions\": [{\"field\": \"x\"}]}]");

        HttpResponse<String> reload = post("/rules/reload", "");

        assertThat(reload.statusCode()).isEqualTo(422);
        assertThat(objectMapper.readTree(reload.body()).get("error").asText()).contains("BAD");
        assertThat(objectMapper.readTree(get("/health").body()).get("rules").asInt()).isEqualTo(5);
    }

    @Test
    void reportsHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("rules").asInt()).isEqualTo(5);
    }

    @Test
    void wrongMethodIsRejected() throws Exception {
        assertThat(get("/evaluate").statusCode()).isEqualTo(405);
        assertThat(post("/health", "").statusCode()).isEqualTo(405);
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        assertThat(get("/rules/unknown").statusCode()).isEqualTo(404);
    }

    @Test
    void invalidJsonIsBadRequest() throws Exception {
        HttpResponse<String> response = post("/evaluate", "{not json");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(objectMapper.readTree(response.body()).get("error").asText()).startsWith("Invalid JSON body");
    }

    @Test
    void nullRecordIsBadRequest() throws Exception {
        HttpResponse<String> single = post("/evaluate", "null");
        HttpResponse<String> batch = post("/evaluate/batch", "[{\"temperature\": 42}, null]");
        HttpResponse<String> nullBatch = post("/evaluate/batch", "null");

        assertThat(single.statusCode()).isEqualTo(400);
        assertThat(batch.statusCode()).isEqualTo(400);
        assertThat(objectMapper.readTree(batch.body()).get("error").asText()).contains("index 1");
        assertThat(nullBatch.statusCode()).isEqualTo(400);
    }

    @Test
    void eachRequestGetsASpan() throws Exception {
        post("/evaluate", "{\"temperature\": 42}");

        // The span ends after the response has been flushed to the client.
        Instant deadline = Instant.now().plusSeconds(5);
        while (spanExporter.getFinishedSpanItems().stream().noneMatch(s -> s.getName().equals("POST /evaluate"))
                && Instant.now().isBefore(deadline)) {
            Thread.sleep(20);
        }
        assertThat(spanExporter.getFinishedSpanItems())
                .extracting(SpanData::getName)
                .contains("POST /evaluate");
    }
}
