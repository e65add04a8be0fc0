package com.sparkify.engine.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparkify.error.SourceReadException;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.DataRow;
import com.sparkify.rowset.RowSchema;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads newline-delimited JSON into an {@link InMemoryRowSet}, inferring the schema the same
 * way Spark's JSON source does: every field seen in any record becomes a column, columns are
 * ordered by name, integral numbers are LONG, fractional numbers DOUBLE, a field seen with both
 * widens to DOUBLE and any other mix becomes STRING. Nested objects and arrays are kept as
 * their JSON text.
 */
public class JsonLinesReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonLinesReader.class);

    private final ObjectMapper mapper;
    private final TableFiles tableFiles;

    public JsonLinesReader() {
        this(new Configuration());
    }

    public JsonLinesReader(Configuration conf) {
        this.mapper = new ObjectMapper();
        this.tableFiles = new TableFiles(conf);
    }

    public InMemoryRowSet read(String location) {
        List<Path> files = tableFiles.expand(location);

        List<JsonNode> records = new ArrayList<>();
        for (Path file : files) {
            readFile(location, file, records);
        }

        RowSchema schema = inferSchema(records);
        List<DataRow> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            rows.add(toRow(schema, record));
        }
        LOGGER.info("Read {} records ({} columns) from {} file(s) at {}",
                rows.size(), schema.size(), files.size(), location);
        return new InMemoryRowSet(schema, rows);
    }

    private void readFile(String location, Path file, List<JsonNode> records) {
        try {
            FileSystem fs = tableFiles.fileSystem(file);
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(fs.open(file), StandardCharsets.UTF_8))) {
                readLines(location, file, reader, records);
            }
        } catch (IOException e) {
            throw new SourceReadException(location, "Failed reading " + file, e);
        }
    }

    private void readLines(String location, Path file, BufferedReader reader, List<JsonNode> records)
            throws IOException {
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (JsonProcessingException e) {
                throw new SourceReadException(location,
                        "Malformed record at " + file + ":" + lineNumber, e);
            }
            if (!node.isObject()) {
                throw new SourceReadException(location,
                        "Expected a JSON object at " + file + ":" + lineNumber);
            }
            records.add(node);
        }
    }

    static RowSchema inferSchema(List<JsonNode> records) {
        Map<String, ColumnType> types = new TreeMap<>();
        for (JsonNode record : records) {
            Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                ColumnType observed = typeOf(field.getValue());
                if (!types.containsKey(field.getKey())) {
                    types.put(field.getKey(), observed);
                } else {
                    types.put(field.getKey(), ColumnType.widen(types.get(field.getKey()), observed));
                }
            }
        }

        List<Column> columns = new ArrayList<>(types.size());
        for (Map.Entry<String, ColumnType> entry : types.entrySet()) {
            // only nulls seen
            ColumnType type = entry.getValue() == null ? ColumnType.STRING : entry.getValue();
            columns.add(Column.of(entry.getKey(), type));
        }
        return new RowSchema(columns);
    }

    private static ColumnType typeOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? ColumnType.LONG : ColumnType.DOUBLE;
        }
        if (node.isNumber()) {
            return ColumnType.DOUBLE;
        }
        if (node.isBoolean()) {
            return ColumnType.BOOLEAN;
        }
        return ColumnType.STRING;
    }

    private static DataRow toRow(RowSchema schema, JsonNode record) {
        Object[] values = new Object[schema.size()];
        for (int i = 0; i < values.length; i++) {
            Column column = schema.columns().get(i);
            values[i] = valueOf(record.get(column.getName()), column.getType());
        }
        return new DataRow(schema, values);
    }

    private static Object valueOf(JsonNode node, ColumnType type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        switch (type) {
            case LONG:
                return node.asLong();
            case DOUBLE:
                return node.asDouble();
            case BOOLEAN:
                return node.asBoolean();
            default:
                return node.isValueNode() ? node.asText() : node.toString();
        }
    }
}
