package com.sparkify.engine.memory;

import com.sparkify.error.SchemaException;
import com.sparkify.error.SourceReadException;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.DataRow;
import com.sparkify.rowset.RowSchema;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.InputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a Hive-partitioned Parquet table from the local file system. Data columns come from
 * the file footers; partition columns are recovered from {@code column=value} directory names,
 * appended after the data columns, and typed as INTEGER, LONG, DOUBLE or STRING depending on
 * what every value parses as.
 */
public class ParquetTableReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableReader.class);

    private final Configuration conf;
    private final TableFiles tableFiles;

    public ParquetTableReader(Configuration conf) {
        this.conf = conf;
        this.tableFiles = new TableFiles(conf);
    }

    public InMemoryRowSet read(String location) {
        try {
            Path root = new Path(location);
            FileSystem fs = tableFiles.fileSystem(root);
            if (!fs.exists(root) || !fs.getFileStatus(root).isDirectory()) {
                throw new SourceReadException(location, "Path does not exist");
            }
            root = fs.makeQualified(root);

            List<Path> files = tableFiles.listVisible(fs, root, ".parquet");
            if (files.isEmpty()) {
                throw new SourceReadException(location, "Unable to infer schema: no Parquet files");
            }

            List<Column> dataColumns = dataColumns(files.get(0));
            List<String> partitionNames = new ArrayList<>(partitionValues(root, files.get(0)).keySet());

            List<Object[]> raw = new ArrayList<>();
            List<Map<String, String>> rawPartitions = new ArrayList<>();
            for (Path file : files) {
                Map<String, String> partition = partitionValues(root, file);
                if (!new ArrayList<>(partition.keySet()).equals(partitionNames)) {
                    throw new SourceReadException(location,
                            "Conflicting partition columns " + partition.keySet() + " and " + partitionNames);
                }
                readFile(file, dataColumns, partition, raw, rawPartitions);
            }

            List<Column> columns = new ArrayList<>(dataColumns);
            for (String name : partitionNames) {
                List<String> values = new ArrayList<>();
                for (Map<String, String> partition : rawPartitions) {
                    values.add(partition.get(name));
                }
                columns.add(Column.of(name, inferPartitionType(values)));
            }
            RowSchema schema = new RowSchema(columns);

            List<DataRow> rows = new ArrayList<>(raw.size());
            for (int r = 0; r < raw.size(); r++) {
                Object[] values = raw.get(r);
                for (int p = 0; p < partitionNames.size(); p++) {
                    int index = dataColumns.size() + p;
                    values[index] = columns.get(index).getType().coerce(rawPartitions.get(r).get(partitionNames.get(p)));
                }
                rows.add(new DataRow(schema, values));
            }
            LOGGER.info("Read {} rows from {} Parquet file(s) at {}", rows.size(), files.size(), location);
            return new InMemoryRowSet(schema, rows);
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceReadException(location, e.getMessage(), e);
        }
    }

    private List<Column> dataColumns(Path file) throws IOException {
        try (ParquetFileReader reader = ParquetFileReader.open(inputFile(file))) {
            Schema avro = new AvroSchemaConverter(conf).convert(reader.getFooter().getFileMetaData().getSchema());
            List<Column> columns = new ArrayList<>();
            for (Schema.Field field : avro.getFields()) {
                columns.add(Column.of(field.name(), columnType(field.name(), field.schema())));
            }
            return columns;
        }
    }

    private void readFile(Path file, List<Column> dataColumns, Map<String, String> partition,
                          List<Object[]> raw, List<Map<String, String>> rawPartitions) throws IOException {
        int width = dataColumns.size() + partition.size();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader
                .<GenericRecord>builder(inputFile(file))
                .withDataModel(GenericData.get())
                .withConf(conf)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                Object[] values = new Object[width];
                for (int i = 0; i < dataColumns.size(); i++) {
                    Column column = dataColumns.get(i);
                    Object value = record.get(column.getName());
                    values[i] = column.getType().coerce(value instanceof CharSequence ? value.toString() : value);
                }
                raw.add(values);
                rawPartitions.add(partition);
            }
        }
    }

    private InputFile inputFile(Path file) throws IOException {
        return HadoopInputFile.fromPath(file, conf);
    }

    private static ColumnType columnType(String name, Schema schema) {
        Schema actual = schema;
        if (schema.getType() == Schema.Type.UNION) {
            actual = null;
            for (Schema branch : schema.getTypes()) {
                if (branch.getType() != Schema.Type.NULL) {
                    actual = branch;
                }
            }
            if (actual == null) {
                return ColumnType.STRING;
            }
        }
        switch (actual.getType()) {
            case STRING:
            case ENUM:
                return ColumnType.STRING;
            case LONG:
                return ColumnType.LONG;
            case INT:
                return ColumnType.INTEGER;
            case DOUBLE:
            case FLOAT:
                return ColumnType.DOUBLE;
            case BOOLEAN:
                return ColumnType.BOOLEAN;
            default:
                throw new SchemaException("Column '" + name + "' has unsupported Parquet type " + actual);
        }
    }

    private static Map<String, String> partitionValues(Path root, Path file) {
        List<String> directories = new ArrayList<>();
        for (Path p = file.getParent(); p != null && !p.equals(root); p = p.getParent()) {
            directories.add(p.getName());
        }
        Collections.reverse(directories);

        Map<String, String> values = new LinkedHashMap<>();
        for (String directory : directories) {
            String[] partition = HivePartitions.parse(directory);
            if (partition != null) {
                values.put(partition[0], partition[1]);
            }
        }
        return values;
    }

    static ColumnType inferPartitionType(List<String> values) {
        ColumnType type = null;
        for (String value : values) {
            if (value == null) {
                continue;
            }
            ColumnType observed;
            if (parses(value, ColumnType.INTEGER)) {
                observed = ColumnType.INTEGER;
            } else if (parses(value, ColumnType.LONG)) {
                observed = ColumnType.LONG;
            } else if (parses(value, ColumnType.DOUBLE)) {
                observed = ColumnType.DOUBLE;
            } else {
                observed = ColumnType.STRING;
            }
            type = ColumnType.widen(type, observed);
        }
        return type == null ? ColumnType.STRING : type;
    }

    private static boolean parses(String value, ColumnType type) {
        try {
            type.coerce(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
