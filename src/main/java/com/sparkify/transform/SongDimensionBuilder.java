package com.sparkify.transform;

import com.sparkify.rowset.RowSet;

import static com.sparkify.rowset.Projection.col;

/**
 * Builds the {@code songs} and {@code artists} dimensions from raw song records.
 */
public class SongDimensionBuilder {

    /**
     * One row per song record, columns copied as they are.
     */
    public RowSet buildSongs(RowSet songRecords) {
        return songRecords.select("song_id", "title", "artist_id", "year", "duration");
    }

    /**
     * Artist attributes renamed, deduplicated on the whole row: an artist whose records
     * disagree on location or coordinates keeps one row per variant.
     */
    public RowSet buildArtists(RowSet songRecords) {
        return songRecords.select(
                        col("artist_id"),
                        col("artist_name").as("name"),
                        col("artist_location").as("location"),
                        col("artist_latitude").as("latitude"),
                        col("artist_longitude").as("longitude"))
                .distinct();
    }
}
