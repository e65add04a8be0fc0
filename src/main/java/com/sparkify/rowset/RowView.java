package com.sparkify.rowset;

/**
 * Read access to a single row by column name. Derived-column functions only see rows through
 * this view, so they run unchanged on every engine.
 */
public interface RowView {

    Object get(String column);

    default String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    default Long getLong(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    default Double getDouble(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }
}
