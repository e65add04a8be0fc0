package com.sparkify.transform;

import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.RowSet;

import java.time.ZoneId;

import static com.sparkify.transform.EventTimestamps.DATETIME;

/**
 * Builds the {@code time} dimension: one row per distinct event time with its calendar
 * breakdown in the configured zone.
 */
public class TimeDimensionBuilder {

    private final EventTimestamps timestamps;

    public TimeDimensionBuilder(ZoneId zone) {
        this.timestamps = new EventTimestamps(zone);
    }

    public RowSet build(RowSet nextSongEvents) {
        return timestamps.addTimestampColumns(nextSongEvents.select("ts"))
                .withColumn("hour", ColumnType.INTEGER, TimeParts.derive(DATETIME, TimeParts.Field.HOUR))
                .withColumn("day", ColumnType.INTEGER, TimeParts.derive(DATETIME, TimeParts.Field.DAY))
                .withColumn("week", ColumnType.INTEGER, TimeParts.derive(DATETIME, TimeParts.Field.WEEK))
                .withColumn("month", ColumnType.INTEGER, TimeParts.derive(DATETIME, TimeParts.Field.MONTH))
                .withColumn("year", ColumnType.INTEGER, TimeParts.derive(DATETIME, TimeParts.Field.YEAR))
                .withColumn("weekday", ColumnType.STRING, TimeParts.derive(DATETIME, TimeParts.Field.WEEKDAY))
                .select("ts", "hour", "day", "week", "month", "year", "weekday")
                .distinct();
    }
}
