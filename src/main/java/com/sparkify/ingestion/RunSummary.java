package com.sparkify.ingestion;

import java.util.EnumMap;
import java.util.Map;

/**
 * Row counts of the tables written during one run.
 */
public class RunSummary {

    private final Map<OutputTable, Long> rowCounts = new EnumMap<>(OutputTable.class);

    void record(OutputTable table, long rows) {
        rowCounts.put(table, rows);
    }

    public long rowCount(OutputTable table) {
        Long rows = rowCounts.get(table);
        if (rows == null) {
            throw new IllegalArgumentException(table.tableName() + " was not written in this run");
        }
        return rows;
    }

    public boolean isComplete() {
        return rowCounts.size() == OutputTable.values().length;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<OutputTable, Long> entry : rowCounts.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry.getKey().tableName()).append('=').append(entry.getValue());
        }
        return sb.toString();
    }
}
