package com.sparkify.transform;

import com.sparkify.rowset.RowSet;

import static com.sparkify.rowset.Projection.col;

/**
 * Builds the {@code users} dimension from song-play events. Level is part of the row, so a
 * user who moved between free and paid shows up once per level.
 */
public class UserDimensionBuilder {

    public RowSet build(RowSet nextSongEvents) {
        return nextSongEvents.select(
                        col("userId").as("user_id"),
                        col("firstName").as("first_name"),
                        col("lastName").as("last_name"),
                        col("gender"),
                        col("level"))
                .distinct();
    }
}
