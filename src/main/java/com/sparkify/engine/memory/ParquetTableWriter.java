package com.sparkify.engine.memory;

import com.sparkify.error.SinkWriteException;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.DataRow;
import com.sparkify.rowset.RowSchema;
import com.sparkify.rowset.RowSet;

import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopOutputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a row-set as a Hive-partitioned Parquet table on the local file system, replacing
 * the destination directory. Each partition directory receives one snappy-compressed file
 * holding the non-partition columns, and a {@code _SUCCESS} marker is left at the root once
 * every file is closed.
 */
public class ParquetTableWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableWriter.class);

    static final String RECORD_NAME = "spark_schema";
    static final String DATA_FILE_NAME = "part-00000.snappy.parquet";

    private final Configuration conf;

    public ParquetTableWriter(Configuration conf) {
        this.conf = conf;
    }

    public void write(RowSet rows, String location, List<String> partitionColumns) {
        RowSchema schema = rows.schema();
        schema.require(partitionColumns.toArray(new String[0]));

        List<Column> dataColumns = new ArrayList<>();
        for (Column column : schema.columns()) {
            if (!partitionColumns.contains(column.getName())) {
                dataColumns.add(column);
            }
        }
        Schema avroSchema = avroSchema(dataColumns);

        try {
            Path root = new Path(location);
            FileSystem fs = root.getFileSystem(conf);
            if (fs.exists(root) && !fs.delete(root, true)) {
                throw new IOException("Could not delete previous contents");
            }
            fs.mkdirs(root);

            Map<String, List<DataRow>> partitions = groupByPartition(rows.collect(), partitionColumns);
            if (partitions.isEmpty() && partitionColumns.isEmpty()) {
                // keep the schema readable for an empty table
                partitions.put("", new ArrayList<>());
            }
            for (Map.Entry<String, List<DataRow>> partition : partitions.entrySet()) {
                Path directory = partition.getKey().isEmpty() ? root : new Path(root, partition.getKey());
                writeFile(new Path(directory, DATA_FILE_NAME), avroSchema, dataColumns, partition.getValue());
            }
            fs.create(new Path(root, "_SUCCESS"), true).close();

            LOGGER.info("Wrote {} rows in {} partition(s) to {}", rows.count(), partitions.size(), location);
        } catch (IOException | IllegalArgumentException e) {
            throw new SinkWriteException(location, e.getMessage(), e);
        }
    }

    private void writeFile(Path file, Schema avroSchema, List<Column> dataColumns, List<DataRow> rows)
            throws IOException {
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                .<GenericRecord>builder(HadoopOutputFile.fromPath(file, conf))
                .withSchema(avroSchema)
                .withConf(conf)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (DataRow row : rows) {
                GenericRecord record = new GenericData.Record(avroSchema);
                for (Column column : dataColumns) {
                    record.put(column.getName(), row.get(column.getName()));
                }
                writer.write(record);
            }
        }
    }

    static Schema avroSchema(List<Column> columns) {
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(RECORD_NAME).fields();
        for (Column column : columns) {
            SchemaBuilder.BaseFieldTypeBuilder<Schema> type = fields.name(column.getName()).type().nullable();
            switch (column.getType()) {
                case LONG:
                    fields = type.longType().noDefault();
                    break;
                case INTEGER:
                    fields = type.intType().noDefault();
                    break;
                case DOUBLE:
                    fields = type.doubleType().noDefault();
                    break;
                case BOOLEAN:
                    fields = type.booleanType().noDefault();
                    break;
                default:
                    fields = type.stringType().noDefault();
                    break;
            }
        }
        return fields.endRecord();
    }

    private static Map<String, List<DataRow>> groupByPartition(List<DataRow> rows, List<String> partitionColumns) {
        Map<String, List<DataRow>> partitions = new LinkedHashMap<>();
        for (DataRow row : rows) {
            StringBuilder directory = new StringBuilder();
            for (String column : partitionColumns) {
                if (directory.length() > 0) {
                    directory.append('/');
                }
                directory.append(HivePartitions.directoryName(column, row.get(column)));
            }
            partitions.computeIfAbsent(directory.toString(), k -> new ArrayList<>()).add(row);
        }
        return partitions;
    }
}
