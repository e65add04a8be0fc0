package com.sparkify.engine.memory;

import com.sparkify.error.SchemaException;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.DataRow;
import com.sparkify.rowset.JoinKey;
import com.sparkify.rowset.Projection;
import com.sparkify.rowset.RowFunction;
import com.sparkify.rowset.RowSchema;
import com.sparkify.rowset.RowSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row-set held entirely on the heap. Suitable for small jobs and tests.
 */
public final class InMemoryRowSet implements RowSet {

    private final RowSchema schema;
    private final List<DataRow> rows;

    public InMemoryRowSet(RowSchema schema, List<DataRow> rows) {
        this.schema = schema;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    /**
     * Builds a row-set from raw value arrays, coercing each value to its column type.
     */
    public static InMemoryRowSet of(RowSchema schema, List<Object[]> values) {
        List<DataRow> rows = new ArrayList<>(values.size());
        for (Object[] raw : values) {
            if (raw.length != schema.size()) {
                throw new SchemaException("Row " + Arrays.toString(raw) + " does not fit " + schema);
            }
            Object[] coerced = new Object[raw.length];
            for (int i = 0; i < raw.length; i++) {
                coerced[i] = schema.columns().get(i).getType().coerce(raw[i]);
            }
            rows.add(new DataRow(schema, coerced));
        }
        return new InMemoryRowSet(schema, rows);
    }

    @Override
    public RowSchema schema() {
        return schema;
    }

    @Override
    public RowSet select(Projection... projections) {
        int[] sources = new int[projections.length];
        List<Column> columns = new ArrayList<>(projections.length);
        for (int i = 0; i < projections.length; i++) {
            sources[i] = schema.indexOf(projections[i].getSource());
            columns.add(schema.columns().get(sources[i]).withName(projections[i].getAlias()));
        }
        RowSchema projected = new RowSchema(columns);

        List<DataRow> out = new ArrayList<>(rows.size());
        for (DataRow row : rows) {
            Object[] values = new Object[sources.length];
            for (int i = 0; i < sources.length; i++) {
                values[i] = row.get(sources[i]);
            }
            out.add(new DataRow(projected, values));
        }
        return new InMemoryRowSet(projected, out);
    }

    @Override
    public RowSet filterEquals(String column, Object value) {
        int index = schema.indexOf(column);
        Object expected = schema.columns().get(index).getType().coerce(value);
        List<DataRow> out = new ArrayList<>();
        for (DataRow row : rows) {
            Object cell = row.get(index);
            if (cell != null && cell.equals(expected)) {
                out.add(row);
            }
        }
        return new InMemoryRowSet(schema, out);
    }

    @Override
    public RowSet distinct() {
        return new InMemoryRowSet(schema, new ArrayList<>(new LinkedHashSet<>(rows)));
    }

    @Override
    public RowSet withColumn(String name, ColumnType type, RowFunction function) {
        List<Column> columns = new ArrayList<>(schema.columns());
        int target;
        if (schema.contains(name)) {
            target = schema.indexOf(name);
            columns.set(target, Column.of(name, type));
        } else {
            target = columns.size();
            columns.add(Column.of(name, type));
        }
        RowSchema extended = new RowSchema(columns);

        List<DataRow> out = new ArrayList<>(rows.size());
        for (DataRow row : rows) {
            Object[] values = Arrays.copyOf(row.values(), columns.size());
            values[target] = type.coerce(function.apply(row));
            out.add(new DataRow(extended, values));
        }
        return new InMemoryRowSet(extended, out);
    }

    /**
     * Hash join: the right side is indexed by its key values, then each left row looks up the
     * index in order, so output order follows the left side, then right-side order per match.
     */
    @Override
    public RowSet leftJoin(RowSet right, JoinKey... keys) {
        if (keys.length == 0) {
            throw new SchemaException("Join needs at least one key");
        }
        RowSchema rightSchema = right.schema();
        int[] leftKeys = new int[keys.length];
        int[] rightKeys = new int[keys.length];
        for (int i = 0; i < keys.length; i++) {
            leftKeys[i] = schema.indexOf(keys[i].getLeftColumn());
            rightKeys[i] = rightSchema.indexOf(keys[i].getRightColumn());
        }

        List<Column> columns = new ArrayList<>(schema.columns());
        for (Column column : rightSchema.columns()) {
            if (schema.contains(column.getName())) {
                throw new SchemaException("Column '" + column.getName()
                        + "' exists on both sides of the join; project one side first");
            }
            columns.add(column);
        }
        RowSchema joined = new RowSchema(columns);

        Map<List<Object>, List<DataRow>> index = new HashMap<>();
        for (DataRow rightRow : right.collect()) {
            List<Object> key = keyOf(rightRow, rightKeys);
            if (key != null) {
                index.computeIfAbsent(key, k -> new ArrayList<>()).add(rightRow);
            }
        }

        int leftWidth = schema.size();
        int rightWidth = rightSchema.size();
        List<DataRow> out = new ArrayList<>();
        for (DataRow leftRow : rows) {
            List<Object> key = keyOf(leftRow, leftKeys);
            List<DataRow> matches = key == null ? null : index.get(key);
            if (matches == null) {
                Object[] values = Arrays.copyOf(leftRow.values(), leftWidth + rightWidth);
                out.add(new DataRow(joined, values));
                continue;
            }
            for (DataRow match : matches) {
                Object[] values = Arrays.copyOf(leftRow.values(), leftWidth + rightWidth);
                System.arraycopy(match.values(), 0, values, leftWidth, rightWidth);
                out.add(new DataRow(joined, values));
            }
        }
        return new InMemoryRowSet(joined, out);
    }

    // null when any key part is null: SQL equality never matches nulls
    private static List<Object> keyOf(DataRow row, int[] positions) {
        List<Object> key = new ArrayList<>(positions.length);
        for (int position : positions) {
            Object value = row.get(position);
            if (value == null) {
                return null;
            }
            key.add(normalizeKey(value));
        }
        return key;
    }

    // 5 (LONG) and 5 (INTEGER) must land in the same bucket
    private static Object normalizeKey(Object value) {
        if (value instanceof Integer) {
            return ((Integer) value).longValue();
        }
        return value;
    }

    @Override
    public List<DataRow> collect() {
        return rows;
    }

    @Override
    public long count() {
        return rows.size();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof InMemoryRowSet)) {
            return false;
        }
        InMemoryRowSet other = (InMemoryRowSet) o;
        return schema.equals(other.schema) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, rows);
    }

    @Override
    public String toString() {
        return "InMemoryRowSet" + schema + " (" + rows.size() + " rows)";
    }
}
