package com.sparkify.engine.spark;

import com.sparkify.rowset.RowView;

import org.apache.spark.sql.Row;

/**
 * Exposes a Spark {@link Row} carrying its schema (a struct argument of a UDF) by column name.
 */
final class SparkRowView implements RowView {

    private final Row row;

    SparkRowView(Row row) {
        this.row = row;
    }

    @Override
    public Object get(String column) {
        return row.get(row.fieldIndex(column));
    }
}
