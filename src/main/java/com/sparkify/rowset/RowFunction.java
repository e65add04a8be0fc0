package com.sparkify.rowset;

import java.io.Serializable;

/**
 * Computes a derived column value from one row. Must be serializable so the Spark engine can
 * ship it to executors; capture only serializable state.
 */
@FunctionalInterface
public interface RowFunction extends Serializable {

    Object apply(RowView row);
}
