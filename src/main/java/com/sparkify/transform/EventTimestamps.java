package com.sparkify.transform;

import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.RowSet;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Adds the intermediate time columns the log-side tables are derived from, each computed
 * from the previous one: {@code timestamp}, the event time in seconds with the milliseconds
 * kept as a fraction, then {@code datetime}, that instant as wall-clock text in the configured
 * zone. Calendar fields are read back from {@code datetime} by {@link TimeParts#derive}.
 */
public class EventTimestamps {

    public static final String TIMESTAMP = "timestamp";
    public static final String DATETIME = "datetime";

    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

    private final ZoneId zone;

    public EventTimestamps(ZoneId zone) {
        this.zone = zone;
    }

    public RowSet addTimestampColumns(RowSet events) {
        ZoneId zone = this.zone;
        return events
                .withColumn(TIMESTAMP, ColumnType.DOUBLE, row -> {
                    Long ts = row.getLong("ts");
                    return ts == null ? null : ts / 1000.0;
                })
                .withColumn(DATETIME, ColumnType.STRING, row -> {
                    Double seconds = row.getDouble(TIMESTAMP);
                    return seconds == null ? null : format(toDateTime(seconds, zone));
                });
    }

    /**
     * Wall-clock time of an epoch-seconds value, to the microsecond.
     */
    static LocalDateTime toDateTime(double epochSeconds, ZoneId zone) {
        long micros = Math.round(epochSeconds * 1_000_000);
        return LocalDateTime.ofInstant(Instant.EPOCH.plus(micros, ChronoUnit.MICROS), zone);
    }

    /**
     * {@code 2018-11-15 00:30:26.796000}, or without the fraction when it is zero.
     */
    static String format(LocalDateTime dateTime) {
        String text = SECONDS.format(dateTime);
        int micros = dateTime.getNano() / 1000;
        return micros == 0 ? text : text + String.format(".%06d", micros);
    }
}
