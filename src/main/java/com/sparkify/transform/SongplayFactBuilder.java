package com.sparkify.transform;

import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.JoinKey;
import com.sparkify.rowset.RowSet;

import java.time.ZoneId;

import static com.sparkify.rowset.Projection.col;
import static com.sparkify.transform.EventTimestamps.DATETIME;

/**
 * Builds the {@code songplays} fact table.
 *
 * <p>Song-play events are matched to raw song records on artist name and title. Events with
 * no match are kept with null {@code song_id} and {@code artist_id}; an event matching
 * several records (same title and artist name, different song ids) yields one row per record.
 * {@code start_time} is the raw epoch-millisecond {@code ts}. {@code year} / {@code month}
 * come from the events' own {@code datetime} column, recomputed here rather than taken from
 * the time dimension.
 */
public class SongplayFactBuilder {

    private final EventTimestamps timestamps;

    public SongplayFactBuilder(ZoneId zone) {
        this.timestamps = new EventTimestamps(zone);
    }

    public RowSet build(RowSet nextSongEvents, RowSet songRecords) {
        RowSet events = timestamps.addTimestampColumns(nextSongEvents)
                .withColumn("year", ColumnType.INTEGER, TimeParts.derive(DATETIME, TimeParts.Field.YEAR))
                .withColumn("month", ColumnType.INTEGER, TimeParts.derive(DATETIME, TimeParts.Field.MONTH));

        RowSet songs = songRecords.select("song_id", "artist_id", "artist_name", "title");

        return events
                .leftJoin(songs,
                        JoinKey.on("artist", "artist_name"),
                        JoinKey.on("song", "title"))
                .select(
                        col("ts").as("start_time"),
                        col("userId").as("user_id"),
                        col("level"),
                        col("song_id"),
                        col("artist_id"),
                        col("sessionId").as("session_id"),
                        col("location"),
                        col("userAgent").as("user_agent"),
                        col("year"),
                        col("month"));
    }
}
