package com.ignis.ruleengine;

import com.ignis.ruleengine.api.exceptions.SourceNotFoundException;
import com.ignis.ruleengine.api.model.Record;
import com.ignis.ruleengine.config.EngineConfig;
import com.ignis.ruleengine.io.AnnotatedRecordWriter;
import com.ignis.ruleengine.io.CsvRecordReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleEngineApplicationTest {

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(RuleEngineApplicationTest.class.getResource(name).toURI());
    }

    @Test
    void classifiesAlertFileAndWritesAnnotatedCopy() throws Exception {
        EngineConfig config = new EngineConfig(resource("/fire-rules.json"), 0, 10, 2);
        Path output = tempDir.resolve("annotated.csv");

        Map<String, Long> counts = new RuleEngineApplication(config).evaluateFile(resource("/alerts.csv"), output);

        assertThat(counts).containsExactly(
                Map.entry("CRITICAL", 1L),
                Map.entry("HIGH", 2L),
                Map.entry("LOW", 1L),
                Map.entry("MEDIUM", 1L),
                Map.entry("NORMAL", 1L));

        List<Record> annotated = new CsvRecordReader().read(output);
        assertThat(annotated).extracting(r -> r.get(AnnotatedRecordWriter.RULE_COLUMN))
                .containsExactly("CRITICAL_01", "HIGH_01", "HIGH_02", "MEDIUM_01", "LOW_01", "NO_RULE");
        assertThat(annotated.get(0).get("zone")).isEqualTo("Monchique");
    }

    @Test
    void skipsOutputWhenNoTargetGiven() throws Exception {
        EngineConfig config = new EngineConfig(resource("/fire-rules.json"), 0, 10, 1);

        Map<String, Long> counts = new RuleEngineApplication(config).evaluateFile(resource("/alerts.csv"), null);

        assertThat(counts.values().stream().mapToLong(Long::longValue).sum()).isEqualTo(6L);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void missingRuleFileIsFatal() {
        EngineConfig config = new EngineConfig(tempDir.resolve("absent.json"), 0, 10, 1);

        assertThatThrownBy(() -> new RuleEngineApplication(config).evaluateFile(tempDir.resolve("alerts.csv"), null))
                .isInstanceOf(SourceNotFoundException.class);
    }

    @Test
    void serveStartsAndStops() throws Exception {
        EngineConfig config = new EngineConfig(resource("/fire-rules.json"), 0, 60, 1);
        RuleEngineApplication app = new RuleEngineApplication(config);

        app.serve();
        app.shutdown();
    }
}
