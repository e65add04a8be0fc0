package com.sparkify.rowset;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A materialized row. Equality is positional over all values, which is what full-row
 * deduplication compares.
 */
public final class DataRow implements RowView {

    private final RowSchema schema;
    private final Object[] values;

    public DataRow(RowSchema schema, Object[] values) {
        if (values.length != schema.size()) {
            throw new IllegalArgumentException(
                    "Row has " + values.length + " values for " + schema.size() + " columns");
        }
        this.schema = schema;
        this.values = values;
    }

    public RowSchema schema() {
        return schema;
    }

    public Object get(int index) {
        return values[index];
    }

    @Override
    public Object get(String column) {
        return values[schema.indexOf(column)];
    }

    public Object[] values() {
        return values.clone();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(schema.columns().get(i).getName(), values[i]);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataRow)) {
            return false;
        }
        return Arrays.equals(values, ((DataRow) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
