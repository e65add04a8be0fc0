package com.sparkify.transform;

import com.sparkify.engine.memory.InMemoryRowSet;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.RowSchema;

import java.util.Arrays;

/**
 * Small song and log row-sets shaped like the raw JSON records.
 */
final class Fixtures {

    static final RowSchema SONG_RECORD = RowSchema.of(
            Column.of("artist_id", ColumnType.STRING),
            Column.of("artist_latitude", ColumnType.DOUBLE),
            Column.of("artist_location", ColumnType.STRING),
            Column.of("artist_longitude", ColumnType.DOUBLE),
            Column.of("artist_name", ColumnType.STRING),
            Column.of("duration", ColumnType.DOUBLE),
            Column.of("song_id", ColumnType.STRING),
            Column.of("title", ColumnType.STRING),
            Column.of("year", ColumnType.LONG));

    static final RowSchema LOG_RECORD = RowSchema.of(
            Column.of("artist", ColumnType.STRING),
            Column.of("firstName", ColumnType.STRING),
            Column.of("gender", ColumnType.STRING),
            Column.of("lastName", ColumnType.STRING),
            Column.of("level", ColumnType.STRING),
            Column.of("location", ColumnType.STRING),
            Column.of("page", ColumnType.STRING),
            Column.of("sessionId", ColumnType.LONG),
            Column.of("song", ColumnType.STRING),
            Column.of("ts", ColumnType.LONG),
            Column.of("userAgent", ColumnType.STRING),
            Column.of("userId", ColumnType.STRING));

    private Fixtures() {
    }

    static InMemoryRowSet songs(Object[]... rows) {
        return InMemoryRowSet.of(SONG_RECORD, Arrays.asList(rows));
    }

    static Object[] song(String songId, String title, String artistId, String artistName,
                         String location, Double latitude, Double longitude, long year, double duration) {
        return new Object[]{artistId, latitude, location, longitude, artistName, duration, songId, title, year};
    }

    static InMemoryRowSet logs(Object[]... rows) {
        return InMemoryRowSet.of(LOG_RECORD, Arrays.asList(rows));
    }

    static Object[] event(String page, String userId, String level, long ts, String artist, String song) {
        String first = "26".equals(userId) ? "Ryan" : "Tegan";
        String last = "26".equals(userId) ? "Smith" : "Levine";
        String gender = "26".equals(userId) ? "M" : "F";
        return new Object[]{artist, first, gender, last, level, "Portland-South Portland, ME", page,
                583L, song, ts, "Mozilla/5.0", userId};
    }
}
