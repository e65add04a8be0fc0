package com.sparkify.engine.memory;

import org.apache.spark.sql.catalyst.catalog.ExternalCatalogUtils;

/**
 * Hive-style {@code column=value} directory names, using Spark's own escaping so a table
 * written here reads back identically through Spark and vice versa.
 */
final class HivePartitions {

    static final String DEFAULT_PARTITION_NAME = ExternalCatalogUtils.DEFAULT_PARTITION_NAME();

    private HivePartitions() {
    }

    static String directoryName(String column, Object value) {
        return ExternalCatalogUtils.escapePathName(column) + "=" + valueName(value);
    }

    // null and empty strings share the default partition, as in Spark
    static String valueName(Object value) {
        if (value == null) {
            return DEFAULT_PARTITION_NAME;
        }
        String text = value.toString();
        return text.isEmpty() ? DEFAULT_PARTITION_NAME : ExternalCatalogUtils.escapePathName(text);
    }

    /**
     * Column name and value of a {@code column=value} directory, or {@code null} when the
     * directory is not a partition. A default-partition value comes back as {@code null}.
     */
    static String[] parse(String directoryName) {
        int eq = directoryName.indexOf('=');
        if (eq <= 0) {
            return null;
        }
        String value = ExternalCatalogUtils.unescapePathName(directoryName.substring(eq + 1));
        return new String[]{
                ExternalCatalogUtils.unescapePathName(directoryName.substring(0, eq)),
                DEFAULT_PARTITION_NAME.equals(value) ? null : value};
    }
}
