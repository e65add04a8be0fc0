package com.sparkify.transform;

import com.sparkify.error.SchemaException;
import com.sparkify.engine.memory.InMemoryRowSet;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.DataRow;
import com.sparkify.rowset.RowSchema;
import com.sparkify.rowset.RowSet;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.sparkify.transform.Fixtures.song;
import static com.sparkify.transform.Fixtures.songs;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SongDimensionBuilderTest {

    private final SongDimensionBuilder builder = new SongDimensionBuilder();

    @Test
    void songsCopyColumnsVerbatimOneRowPerRecord() {
        RowSet songs = builder.buildSongs(songs(
                song("SOCIWDW12A8C13D406", "Soul Deep", "ARMJAGH1187FB546F3", "The Box Tops",
                        "Memphis, TN", 35.14968, -90.04892, 1969, 148.03546),
                song("SOMZWCG12A8C13C480", "I Didn't Mean To", "ARD7TVE1187B99BFB1", "Casual",
                        "California - LA", null, null, 0, 218.93179)));

        assertThat(songs.columnNames()).containsExactly("song_id", "title", "artist_id", "year", "duration");
        List<DataRow> rows = songs.collect();
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).values()).containsExactly(
                "SOCIWDW12A8C13D406", "Soul Deep", "ARMJAGH1187FB546F3", 1969L, 148.03546);
        assertThat(rows.get(1).get("year")).isEqualTo(0L);
    }

    @Test
    void identicalArtistRecordsCollapse() {
        RowSet artists = builder.buildArtists(songs(
                song("SOCIWDW12A8C13D406", "Soul Deep", "ARMJAGH1187FB546F3", "The Box Tops",
                        "Memphis, TN", 35.14968, -90.04892, 1969, 148.03546),
                song("SOGDBUF12A8C140FAA", "Cry Like A Baby", "ARMJAGH1187FB546F3", "The Box Tops",
                        "Memphis, TN", 35.14968, -90.04892, 1968, 152.92036)));

        assertThat(artists.columnNames()).containsExactly("artist_id", "name", "location", "latitude", "longitude");
        assertThat(artists.collect()).hasSize(1);
        assertThat(artists.collect().get(0).values()).containsExactly(
                "ARMJAGH1187FB546F3", "The Box Tops", "Memphis, TN", 35.14968, -90.04892);
    }

    @Test
    void artistRecordsDifferingInAnyFieldBothSurvive() {
        RowSet artists = builder.buildArtists(songs(
                song("SOMZWCG12A8C13C480", "I Didn't Mean To", "ARD7TVE1187B99BFB1", "Casual",
                        "California - LA", null, null, 0, 218.93179),
                song("SOQHXMF12AB0182363", "Young Boy Blues", "ARD7TVE1187B99BFB1", "Casual",
                        "Los Angeles, CA", null, null, 0, 218.77506)));

        assertThat(artists.collect())
                .extracting(row -> row.get("location"))
                .containsExactly("California - LA", "Los Angeles, CA");
    }

    @Test
    void missingSourceColumnIsASchemaError() {
        RowSet titlesOnly = InMemoryRowSet.of(
                RowSchema.of(Column.of("title", ColumnType.STRING)), Collections.emptyList());

        assertThatThrownBy(() -> builder.buildSongs(titlesOnly)).isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> builder.buildArtists(titlesOnly)).isInstanceOf(SchemaException.class);
    }
}
