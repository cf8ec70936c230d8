package com.ignis.ruleengine.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ignis.ruleengine.api.model.EvaluationResult;
import com.ignis.ruleengine.api.model.Record;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes each record back out as CSV with its classification appended in the
 * {@code risk}, {@code recommended_action} and {@code matched_rule} columns.
 *
 * <p>Record columns appear in first-seen order across all records; a record
 * lacking a column gets an empty cell.
 */
public class AnnotatedRecordWriter {

    public static final String RISK_COLUMN = "risk";
    public static final String ACTION_COLUMN = "recommended_action";
    public static final String RULE_COLUMN = "matched_rule";

    private final CsvMapper csvMapper = new CsvMapper();

    public void write(Path target, List<? extends Record> records, List<EvaluationResult> results)
            throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(writer, records, results);
        }
    }

    /**
     * Writes to an open writer. The writer is flushed but not closed.
     *
     * @throws IllegalArgumentException if the lists differ in size
     */
    public void write(Writer writer, List<? extends Record> records, List<EvaluationResult> results)
            throws IOException {
        if (records.size() != results.size()) {
            throw new IllegalArgumentException(String.format(
                    "Got %d records but %d results", records.size(), results.size()));
        }

        Set<String> columns = new LinkedHashSet<>();
        records.forEach(r -> columns.addAll(r.fields()));
        columns.remove(RISK_COLUMN);
        columns.remove(ACTION_COLUMN);
        columns.remove(RULE_COLUMN);

        CsvSchema.Builder builder = CsvSchema.builder();
        columns.forEach(builder::addColumn);
        builder.addColumn(RISK_COLUMN).addColumn(ACTION_COLUMN).addColumn(RULE_COLUMN);
        CsvSchema schema = builder.build().withHeader();

        SequenceWriter rows = csvMapper.writer(schema).writeValues(writer);
        for (int i = 0; i < records.size(); i++) {
            EvaluationResult result = results.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                Object value = records.get(i).get(column);
                row.put(column, value == null ? "" : value);
            }
            row.put(RISK_COLUMN, result.risk());
            row.put(ACTION_COLUMN, result.action());
            row.put(RULE_COLUMN, result.matchedRuleId());
            rows.write(row);
        }
        rows.flush();
    }
}
