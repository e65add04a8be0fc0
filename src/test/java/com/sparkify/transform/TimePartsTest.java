package com.sparkify.transform;

import com.sparkify.rowset.RowView;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TimePartsTest {

    private static final long TS = 1542241826796L;

    @Test
    void derivesCalendarFieldsInUtc() {
        TimeParts parts = TimeParts.of(TS, ZoneOffset.UTC);

        assertThat(parts.getHour()).isEqualTo(0);
        assertThat(parts.getDay()).isEqualTo(15);
        assertThat(parts.getWeek()).isEqualTo(46);
        assertThat(parts.getMonth()).isEqualTo(11);
        assertThat(parts.getYear()).isEqualTo(2018);
        assertThat(parts.getWeekday()).isEqualTo("Thu");
    }

    @Test
    void zoneMovesTheWallClock() {
        TimeParts parts = TimeParts.of(TS, ZoneId.of("America/New_York"));

        assertThat(parts.getHour()).isEqualTo(19);
        assertThat(parts.getDay()).isEqualTo(14);
        assertThat(parts.getWeekday()).isEqualTo("Wed");
    }

    @Test
    void sameInputSameOutput() {
        ZoneId zone = ZoneId.of("Europe/Berlin");
        TimeParts first = TimeParts.of(TS, zone);
        TimeParts second = TimeParts.of(TS, zone);

        assertThat(second).usingRecursiveComparison().isEqualTo(first);
    }

    @Test
    void parsesRenderedDatetimeWithOrWithoutFraction() {
        TimeParts withFraction = TimeParts.parse("2018-11-15 00:30:26.796000");
        TimeParts wholeSeconds = TimeParts.parse("2018-11-15 00:30:26");

        assertThat(withFraction).usingRecursiveComparison().isEqualTo(TimeParts.of(TS, ZoneOffset.UTC));
        assertThat(wholeSeconds).usingRecursiveComparison().isEqualTo(withFraction);
    }

    @Test
    void deriveReadsTheDatetimeColumn() {
        RowView row = column -> "datetime".equals(column) ? "2018-11-14 19:30:26.796000" : null;

        assertThat(TimeParts.derive("datetime", TimeParts.Field.HOUR).apply(row)).isEqualTo(19);
        assertThat(TimeParts.derive("datetime", TimeParts.Field.WEEKDAY).apply(row)).isEqualTo("Wed");
        assertThat(TimeParts.derive("missing", TimeParts.Field.DAY).apply(row)).isNull();
    }

    @Test
    void isoWeekAtYearBoundary() {
        // 2018-12-31 is a Monday and belongs to ISO week 1 of 2019
        TimeParts parts = TimeParts.of(1546214400000L, ZoneOffset.UTC);

        assertThat(parts.getYear()).isEqualTo(2018);
        assertThat(parts.getWeek()).isEqualTo(1);
        assertThat(parts.getWeekday()).isEqualTo("Mon");
    }
}
