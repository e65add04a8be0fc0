package com.sparkify.rowset;

import java.util.List;

/**
 * An ordered sequence of rows over named, typed columns.
 *
 * <p>Implementations are immutable: every operation returns a new row-set and leaves the
 * receiver untouched. Operations referencing an unknown column fail with
 * {@link com.sparkify.error.SchemaException}.
 */
public interface RowSet {

    RowSchema schema();

    default List<Column> columns() {
        return schema().columns();
    }

    default List<String> columnNames() {
        return schema().names();
    }

    /**
     * Keeps the given columns in the given order, renaming where the projection says so.
     */
    RowSet select(Projection... projections);

    default RowSet select(String... columns) {
        return select(Projection.cols(columns));
    }

    /**
     * Keeps rows whose column equals {@code value}. A null cell never matches.
     */
    RowSet filterEquals(String column, Object value);

    /**
     * Removes rows equal to an earlier row on every column.
     */
    RowSet distinct();

    /**
     * Adds a column computed per row, or replaces the column with the same name in place.
     */
    RowSet withColumn(String name, ColumnType type, RowFunction function);

    /**
     * Left outer equi-join. Every left row survives; left rows without a match get nulls in
     * the right-side columns; a left row matching several right rows yields one row per match.
     * Null keys never match. The two sides must not share column names.
     */
    RowSet leftJoin(RowSet right, JoinKey... keys);

    List<DataRow> collect();

    long count();
}
