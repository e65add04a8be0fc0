package com.sparkify.engine;

import com.sparkify.rowset.RowSet;

import java.util.List;

/**
 * Storage I/O collaborator of the transform builders: produces row-sets from raw records and
 * persists finished row-sets.
 */
public interface RowSetEngine extends AutoCloseable {

    /**
     * Reads line-delimited JSON records. {@code path} is either a glob pattern such as
     * {@code log_data/*.json} or a directory that is read recursively.
     * Column names and types are inferred from the records.
     *
     * @throws com.sparkify.error.SourceReadException if nothing matches or a record cannot be parsed
     */
    RowSet read(String path);

    /**
     * Writes {@code rows} as Parquet under {@code path}, replacing whatever was there. Each
     * distinct combination of {@code partitionColumns} values goes to its own
     * {@code col=value} directory and those columns are left out of the files.
     *
     * @throws com.sparkify.error.SinkWriteException if the data cannot be persisted
     */
    void write(RowSet rows, String path, List<String> partitionColumns);

    /**
     * Reads back a Parquet table written by {@link #write}, restoring partition columns from
     * the directory names after the data columns.
     */
    RowSet readParquet(String path);

    String name();

    @Override
    void close();
}
