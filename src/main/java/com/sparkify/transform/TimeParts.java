package com.sparkify.transform;

import com.sparkify.rowset.RowFunction;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.util.Locale;

/**
 * Calendar fields of an event's wall-clock time.
 */
public final class TimeParts {

    /**
     * A single calendar field, usable as a derived column.
     */
    public enum Field {
        HOUR {
            @Override
            Object valueOf(TimeParts parts) {
                return parts.hour;
            }
        },
        DAY {
            @Override
            Object valueOf(TimeParts parts) {
                return parts.day;
            }
        },
        WEEK {
            @Override
            Object valueOf(TimeParts parts) {
                return parts.week;
            }
        },
        MONTH {
            @Override
            Object valueOf(TimeParts parts) {
                return parts.month;
            }
        },
        YEAR {
            @Override
            Object valueOf(TimeParts parts) {
                return parts.year;
            }
        },
        WEEKDAY {
            @Override
            Object valueOf(TimeParts parts) {
                return parts.weekday;
            }
        };

        abstract Object valueOf(TimeParts parts);
    }

    private final int hour;
    private final int day;
    private final int week;
    private final int month;
    private final int year;
    private final String weekday;

    private static final DateTimeFormatter DATETIME_TEXT = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter(Locale.US);

    private TimeParts(LocalDateTime dateTime) {
        this.hour = dateTime.getHour();
        this.day = dateTime.getDayOfMonth();
        this.week = dateTime.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        this.month = dateTime.getMonthValue();
        this.year = dateTime.getYear();
        this.weekday = dateTime.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.US);
    }

    public static TimeParts of(long epochMillis, ZoneId zone) {
        return new TimeParts(LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), zone));
    }

    /**
     * Parses {@code yyyy-MM-dd HH:mm:ss} with an optional fraction, as written to the
     * {@code datetime} column.
     *
     * @throws DateTimeParseException if the text is not in that form
     */
    public static TimeParts parse(String datetime) {
        return new TimeParts(LocalDateTime.parse(datetime, DATETIME_TEXT));
    }

    /**
     * Derived-column function reading wall-clock text from {@code datetimeColumn}. Null in, null out.
     */
    public static RowFunction derive(String datetimeColumn, Field field) {
        return row -> {
            String datetime = row.getString(datetimeColumn);
            return datetime == null ? null : field.valueOf(parse(datetime));
        };
    }

    public int getHour() {
        return hour;
    }

    public int getDay() {
        return day;
    }

    /** ISO-8601 week of the week-based year (weeks start Monday). */
    public int getWeek() {
        return week;
    }

    public int getMonth() {
        return month;
    }

    public int getYear() {
        return year;
    }

    /** Three-letter English day name, e.g. {@code Thu}. */
    public String getWeekday() {
        return weekday;
    }

    @Override
    public String toString() {
        return year + "-" + month + "-" + day + " " + hour + "h week " + week + " " + weekday;
    }
}
