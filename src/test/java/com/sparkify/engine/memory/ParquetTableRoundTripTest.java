package com.sparkify.engine.memory;

import com.sparkify.error.SchemaException;
import com.sparkify.error.SinkWriteException;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.DataRow;
import com.sparkify.rowset.RowSchema;
import com.sparkify.rowset.RowSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParquetTableRoundTripTest {

    private static final RowSchema TIME = RowSchema.of(
            Column.of("ts", ColumnType.LONG),
            Column.of("hour", ColumnType.INTEGER),
            Column.of("weekday", ColumnType.STRING),
            Column.of("year", ColumnType.INTEGER),
            Column.of("month", ColumnType.INTEGER));

    private final InMemoryEngine engine = new InMemoryEngine();

    @Test
    void partitionedWriteReadsBackSameRows(@TempDir Path dir) {
        InMemoryRowSet time = InMemoryRowSet.of(TIME, Arrays.asList(
                new Object[]{1542241826796L, 0, "Thu", 2018, 11},
                new Object[]{1542171963796L, 5, "Wed", 2018, 11},
                new Object[]{1546300800000L, 0, "Tue", 2019, 1},
                new Object[]{1546300800000L, 0, "Tue", 2019, 1}));
        String path = dir.resolve("time/time.parquet").toString();

        engine.write(time, path, Arrays.asList("year", "month"));

        assertThat(dir.resolve("time/time.parquet/year=2018/month=11")).isDirectory();
        assertThat(dir.resolve("time/time.parquet/year=2019/month=1")).isDirectory();
        assertThat(dir.resolve("time/time.parquet/_SUCCESS")).exists();

        RowSet readBack = engine.readParquet(path);
        assertThat(readBack.columnNames()).containsExactly("ts", "hour", "weekday", "year", "month");
        assertThat(readBack.schema().column("year").getType()).isEqualTo(ColumnType.INTEGER);
        assertThat(multiset(readBack.select("ts", "hour", "weekday", "year", "month")))
                .isEqualTo(multiset(time));
    }

    @Test
    void nullAndSpecialPartitionValuesSurvive(@TempDir Path dir) {
        RowSchema schema = RowSchema.of(
                Column.of("song_id", ColumnType.STRING),
                Column.of("artist_id", ColumnType.STRING));
        InMemoryRowSet rows = InMemoryRowSet.of(schema, Arrays.asList(
                new Object[]{"SO1", null},
                new Object[]{"SO2", "AR/1=2"}));
        String path = dir.resolve("songs").toString();

        engine.write(rows, path, Collections.singletonList("artist_id"));

        assertThat(dir.resolve("songs/artist_id=__HIVE_DEFAULT_PARTITION__")).isDirectory();
        assertThat(dir.resolve("songs/artist_id=AR%2F1%3D2")).isDirectory();
        assertThat(multiset(engine.readParquet(path))).isEqualTo(multiset(rows));
    }

    @Test
    void writeReplacesPreviousContents(@TempDir Path dir) throws Exception {
        String path = dir.resolve("users").toString();
        RowSchema schema = RowSchema.of(Column.of("user_id", ColumnType.STRING));
        engine.write(InMemoryRowSet.of(schema, Arrays.<Object[]>asList(new Object[]{"26"}, new Object[]{"80"})),
                path, Collections.emptyList());
        Files.write(dir.resolve("users/stale.parquet"), new byte[]{1, 2, 3});

        engine.write(InMemoryRowSet.of(schema, Arrays.<Object[]>asList(new Object[]{"9"})),
                path, Collections.emptyList());

        assertThat(dir.resolve("users/stale.parquet")).doesNotExist();
        assertThat(engine.readParquet(path).collect())
                .extracting(row -> row.get("user_id"))
                .containsExactly("9");
    }

    @Test
    void emptyUnpartitionedTableKeepsItsSchema(@TempDir Path dir) {
        String path = dir.resolve("artists").toString();
        engine.write(InMemoryRowSet.of(TIME, Collections.emptyList()), path, Collections.emptyList());

        RowSet readBack = engine.readParquet(path);
        assertThat(readBack.count()).isZero();
        assertThat(readBack.columnNames()).containsExactly("ts", "hour", "weekday", "year", "month");
    }

    @Test
    void unsupportedFileSystemIsASinkWriteError() {
        String location = "nosuchfs://bucket/songs";

        assertThatThrownBy(() -> engine.write(InMemoryRowSet.of(TIME, Collections.emptyList()),
                location, Collections.emptyList()))
                .isInstanceOf(SinkWriteException.class)
                .extracting(e -> ((SinkWriteException) e).getPath())
                .isEqualTo(location);
    }

    @Test
    void sparkStyleDirectoriesAreHidden() {
        assertThat(TableFiles.isHidden("_SUCCESS")).isTrue();
        assertThat(TableFiles.isHidden("_temporary")).isTrue();
        assertThat(TableFiles.isHidden(".part-00000.snappy.parquet.crc")).isTrue();
        assertThat(TableFiles.isHidden("_col=1")).isFalse();
        assertThat(TableFiles.isHidden("year=2018")).isFalse();
    }

    @Test
    void unknownPartitionColumnFails(@TempDir Path dir) {
        assertThatThrownBy(() -> engine.write(InMemoryRowSet.of(TIME, Collections.emptyList()),
                dir.resolve("t").toString(), Collections.singletonList("day")))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void partitionTypesAreInferredFromDirectoryNames() {
        assertThat(ParquetTableReader.inferPartitionType(Arrays.asList("2018", "2019")))
                .isEqualTo(ColumnType.INTEGER);
        assertThat(ParquetTableReader.inferPartitionType(Arrays.asList("2018", "1542241826796")))
                .isEqualTo(ColumnType.LONG);
        assertThat(ParquetTableReader.inferPartitionType(Arrays.asList("1", "2.5")))
                .isEqualTo(ColumnType.DOUBLE);
        assertThat(ParquetTableReader.inferPartitionType(Arrays.asList("ARD7TVE1187B99BFB1", null)))
                .isEqualTo(ColumnType.STRING);
    }

    static Map<List<Object>, Long> multiset(RowSet rows) {
        return rows.collect().stream()
                .map(DataRow::values)
                .map(Arrays::asList)
                .collect(Collectors.groupingBy(values -> values, Collectors.counting()));
    }
}
