package com.sparkify.rowset;

import com.sparkify.error.SchemaException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowSchemaTest {

    private final RowSchema schema = RowSchema.of(
            Column.of("song_id", ColumnType.STRING),
            Column.of("year", ColumnType.LONG));

    @Test
    void looksUpColumnsByName() {
        assertThat(schema.indexOf("year")).isEqualTo(1);
        assertThat(schema.column("song_id").getType()).isEqualTo(ColumnType.STRING);
        assertThat(schema.names()).containsExactly("song_id", "year");
    }

    @Test
    void missingColumnNamesWhatIsAvailable() {
        assertThatThrownBy(() -> schema.require("song_id", "title"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("'title'")
                .hasMessageContaining("[song_id, year]");
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> RowSchema.of(
                Column.of("ts", ColumnType.LONG),
                Column.of("ts", ColumnType.STRING)))
                .isInstanceOf(SchemaException.class);
    }
}
