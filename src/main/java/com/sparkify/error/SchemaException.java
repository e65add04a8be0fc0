package com.sparkify.error;

import java.util.List;

/**
 * A referenced column is absent from a row-set, or two row-sets cannot be combined because
 * their columns clash.
 */
public class SchemaException extends EtlException {

    public SchemaException(String message) {
        super(message);
    }

    public static SchemaException missingColumn(String column, List<String> available) {
        return new SchemaException("Column '" + column + "' not found. Available columns: " + available);
    }
}
