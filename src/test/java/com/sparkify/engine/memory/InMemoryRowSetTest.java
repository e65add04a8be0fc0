package com.sparkify.engine.memory;

import com.sparkify.error.SchemaException;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.DataRow;
import com.sparkify.rowset.JoinKey;
import com.sparkify.rowset.RowSchema;
import com.sparkify.rowset.RowSet;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.sparkify.rowset.Projection.col;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRowSetTest {

    private static final RowSchema PLAYS = RowSchema.of(
            Column.of("user", ColumnType.STRING),
            Column.of("song", ColumnType.STRING),
            Column.of("page", ColumnType.STRING));

    private static final RowSchema CATALOG = RowSchema.of(
            Column.of("song_id", ColumnType.STRING),
            Column.of("title", ColumnType.STRING));

    private final InMemoryRowSet plays = InMemoryRowSet.of(PLAYS, Arrays.asList(
            new Object[]{"26", "Soul Deep", "NextSong"},
            new Object[]{"9", null, "Home"},
            new Object[]{"26", "Soul Deep", "NextSong"},
            new Object[]{"80", "Twin Song", "NextSong"}));

    @Test
    void selectRenamesAndReorders() {
        RowSet projected = plays.select(col("song").as("title"), col("user").as("user_id"));

        assertThat(projected.columnNames()).containsExactly("title", "user_id");
        assertThat(projected.collect().get(0).values()).containsExactly("Soul Deep", "26");
        assertThat(projected.count()).isEqualTo(4);
    }

    @Test
    void selectOfUnknownColumnFails() {
        assertThatThrownBy(() -> plays.select("artist"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("artist");
    }

    @Test
    void filterEqualsSkipsNullCells() {
        assertThat(plays.filterEquals("page", "NextSong").count()).isEqualTo(3);
        assertThat(plays.filterEquals("song", "Soul Deep").count()).isEqualTo(2);
    }

    @Test
    void distinctKeepsFirstOccurrenceOrder() {
        List<String> users = plays.distinct().collect().stream()
                .map(row -> (String) row.get("user"))
                .collect(Collectors.toList());

        assertThat(users).containsExactly("26", "9", "80");
    }

    @Test
    void withColumnAppendsOrReplaces() {
        RowSet appended = plays.withColumn("is_play", ColumnType.BOOLEAN,
                row -> "NextSong".equals(row.get("page")));
        assertThat(appended.columnNames()).containsExactly("user", "song", "page", "is_play");
        assertThat(appended.collect().get(1).get("is_play")).isEqualTo(false);

        RowSet replaced = plays.withColumn("user", ColumnType.LONG, row -> row.getString("user"));
        assertThat(replaced.columnNames()).containsExactly("user", "song", "page");
        assertThat(replaced.schema().column("user").getType()).isEqualTo(ColumnType.LONG);
        assertThat(replaced.collect().get(0).get("user")).isEqualTo(26L);
    }

    @Test
    void leftJoinKeepsUnmatchedAndFansOut() {
        InMemoryRowSet catalog = InMemoryRowSet.of(CATALOG, Arrays.asList(
                new Object[]{"SOCIWDW12A8C13D406", "Soul Deep"},
                new Object[]{"SOTWIN00000000001", "Twin Song"},
                new Object[]{"SOTWIN00000000002", "Twin Song"}));

        RowSet joined = plays.leftJoin(catalog, JoinKey.on("song", "title"));

        assertThat(joined.columnNames()).containsExactly("user", "song", "page", "song_id", "title");
        List<DataRow> rows = joined.collect();
        assertThat(rows).hasSize(5);
        // null key never matches, row kept
        assertThat(rows.get(1).get("song_id")).isNull();
        assertThat(rows.get(1).get("title")).isNull();
        assertThat(rows.stream().filter(r -> "80".equals(r.get("user"))).map(r -> r.get("song_id")))
                .containsExactly("SOTWIN00000000001", "SOTWIN00000000002");
    }

    @Test
    void leftJoinRejectsClashingColumns() {
        InMemoryRowSet other = InMemoryRowSet.of(RowSchema.of(Column.of("song", ColumnType.STRING)),
                Arrays.<Object[]>asList(new Object[]{"Soul Deep"}));

        assertThatThrownBy(() -> plays.leftJoin(other, JoinKey.on("song", "song")))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("both sides");
    }

    @Test
    void operationsLeaveReceiverUntouched() {
        plays.select("user").distinct();
        plays.withColumn("extra", ColumnType.STRING, row -> "x");

        assertThat(plays.columnNames()).containsExactly("user", "song", "page");
        assertThat(plays.count()).isEqualTo(4);
    }
}
