package com.sparkify.ingestion;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The five star-schema tables, where they go below the output base and how they are split.
 */
public enum OutputTable {
    SONGS("songs/songs.parquet", "year", "artist_id"),
    ARTISTS("artists/artists.parquet"),
    USERS("users/users.parquet"),
    TIME("time/time.parquet", "year", "month"),
    SONGPLAYS("songplays/songplays.parquet", "year", "month");

    private final String relativePath;
    private final List<String> partitionColumns;

    OutputTable(String relativePath, String... partitionColumns) {
        this.relativePath = relativePath;
        this.partitionColumns = Collections.unmodifiableList(Arrays.asList(partitionColumns));
    }

    public List<String> getPartitionColumns() {
        return partitionColumns;
    }

    public String pathUnder(String outputData) {
        return DataLoader.resolve(outputData, relativePath);
    }

    public String tableName() {
        return name().toLowerCase();
    }
}
