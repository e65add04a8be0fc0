package com.sparkify.rowset;

import com.sparkify.error.SchemaException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, uniquely named columns of a row-set.
 */
public final class RowSchema implements Serializable {
    private static final long serialVersionUID = 1L;

    private final List<Column> columns;
    private final Map<String, Integer> positions;

    public RowSchema(List<Column> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.positions = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).getName();
            if (positions.put(name, i) != null) {
                throw new SchemaException("Duplicate column '" + name + "' in " + names(columns));
            }
        }
    }

    public static RowSchema of(Column... columns) {
        List<Column> list = new ArrayList<>();
        Collections.addAll(list, columns);
        return new RowSchema(list);
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> names() {
        return names(columns);
    }

    public int size() {
        return columns.size();
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    /**
     * Position of the named column.
     *
     * @throws SchemaException if the column does not exist
     */
    public int indexOf(String name) {
        Integer index = positions.get(name);
        if (index == null) {
            throw SchemaException.missingColumn(name, names());
        }
        return index;
    }

    public Column column(String name) {
        return columns.get(indexOf(name));
    }

    public void require(String... names) {
        for (String name : names) {
            indexOf(name);
        }
    }

    private static List<String> names(List<Column> columns) {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RowSchema && columns.equals(((RowSchema) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
