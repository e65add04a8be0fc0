package com.sparkify.rowset;

/**
 * Value types a row-set column can hold, each carried as its boxed Java type.
 * {@code null} is allowed for every type.
 */
public enum ColumnType {
    STRING(String.class),
    LONG(Long.class),
    INTEGER(Integer.class),
    DOUBLE(Double.class),
    BOOLEAN(Boolean.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    /**
     * Common type of two observations of the same field, following the JSON reader's rules:
     * integral and floating widen to DOUBLE, INTEGER widens to LONG, anything else falls back to STRING.
     */
    public static ColumnType widen(ColumnType a, ColumnType b) {
        if (a == null) {
            return b;
        }
        if (b == null || a == b) {
            return a;
        }
        if (a.isNumeric() && b.isNumeric()) {
            if (a == DOUBLE || b == DOUBLE) {
                return DOUBLE;
            }
            return LONG;
        }
        return STRING;
    }

    public boolean isNumeric() {
        return this == LONG || this == INTEGER || this == DOUBLE;
    }

    /**
     * Converts a value produced for this column into its canonical boxed type.
     */
    public Object coerce(Object value) {
        if (value == null || javaType.isInstance(value)) {
            return value;
        }
        switch (this) {
            case STRING:
                return value.toString();
            case LONG:
                if (value instanceof Number) {
                    return ((Number) value).longValue();
                }
                return Long.parseLong(value.toString());
            case INTEGER:
                if (value instanceof Number) {
                    return ((Number) value).intValue();
                }
                return Integer.parseInt(value.toString());
            case DOUBLE:
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                return Double.parseDouble(value.toString());
            case BOOLEAN:
                return Boolean.parseBoolean(value.toString());
            default:
                throw new IllegalStateException("Unhandled column type " + this);
        }
    }
}
