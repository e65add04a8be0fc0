package com.sparkify.engine.memory;

import com.sparkify.engine.RowSetEngine;
import com.sparkify.rowset.RowSet;

import org.apache.hadoop.conf.Configuration;

import java.util.List;

/**
 * Engine that loads whole tables onto the heap and works on the local file system only.
 */
public class InMemoryEngine implements RowSetEngine {

    private final JsonLinesReader jsonReader;
    private final ParquetTableWriter parquetWriter;
    private final ParquetTableReader parquetReader;

    public InMemoryEngine() {
        this(new Configuration());
    }

    public InMemoryEngine(Configuration conf) {
        this.jsonReader = new JsonLinesReader(conf);
        this.parquetWriter = new ParquetTableWriter(conf);
        this.parquetReader = new ParquetTableReader(conf);
    }

    @Override
    public RowSet read(String path) {
        return jsonReader.read(path);
    }

    @Override
    public void write(RowSet rows, String path, List<String> partitionColumns) {
        parquetWriter.write(rows, path, partitionColumns);
    }

    @Override
    public RowSet readParquet(String path) {
        return parquetReader.read(path);
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public void close() {
        // nothing held open
    }
}
