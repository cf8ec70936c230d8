package com.ignis.ruleengine.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ignis.ruleengine.api.exceptions.MalformedSourceException;
import com.ignis.ruleengine.api.exceptions.SourceNotFoundException;
import com.ignis.ruleengine.api.model.MapRecord;
import com.ignis.ruleengine.api.model.Record;
import org.apache.commons.lang3.math.NumberUtils;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads alert records from a CSV file whose first row names the fields.
 *
 * <p>Cells are typed on the way in: plain decimal numbers become {@link Long} or
 * {@link Double}, empty cells are left out so the record simply lacks that field,
 * anything else stays a string. A typical alert file looks like:
 * <pre>
 * timestamp,zone,temperature,humidity,wind_speed,event_type
 * 2024-07-01 00:00:00,Monchique,42,18,25.3,raio_seco
 * </pre>
 */
public class CsvRecordReader {
    private static final Logger logger = Logger.getLogger(CsvRecordReader.class.getName());

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    /**
     * @throws SourceNotFoundException   if the file does not exist
     * @throws MalformedSourceException  if the file is not readable as CSV
     * @throws IOException               on other I/O failures
     */
    public List<Record> read(Path csvPath) throws IOException {
        String source = csvPath.toString();
        if (!Files.exists(csvPath)) {
            throw new SourceNotFoundException(source);
        }
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            List<Record> records = read(reader, source);
            logger.info(String.format("Read %d records from '%s'", records.size(), source));
            return records;
        } catch (NoSuchFileException e) {
            throw new SourceNotFoundException(source, e);
        }
    }

    /**
     * Reads all rows from a reader, closing it when done.
     */
    public List<Record> read(Reader reader, String sourceName) throws IOException {
        List<Record> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .readValues(reader)) {
            while (rows.hasNextValue()) {
                records.add(toRecord(rows.nextValue()));
            }
        } catch (JsonProcessingException e) {
            throw new MalformedSourceException(sourceName, e.getOriginalMessage(), e);
        } catch (RuntimeJsonMappingException e) {
            throw new MalformedSourceException(sourceName, e.getMessage(), e);
        }
        return records;
    }

    private static Record toRecord(Map<String, String> row) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        row.forEach((column, cell) -> {
            if (cell == null) return;
            String trimmed = cell.trim();
            if (!trimmed.isEmpty()) {
                attributes.put(column.trim(), typed(trimmed));
            }
        });
        return MapRecord.of(attributes);
    }

    static Object typed(String cell) {
        if (!NumberUtils.isParsable(cell)) {
            return cell;
        }
        if (cell.indexOf('.') < 0) {
            try {
                return Long.parseLong(cell);
            } catch (NumberFormatException e) {
                return new BigDecimal(cell);
            }
        }
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            // isParsable accepts non-ASCII digits that parseDouble does not
            return cell;
        }
    }
}
