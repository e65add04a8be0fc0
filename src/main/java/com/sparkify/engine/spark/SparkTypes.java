package com.sparkify.engine.spark;

import com.sparkify.error.SchemaException;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.RowSchema;

import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;

import java.util.ArrayList;
import java.util.List;

final class SparkTypes {

    private SparkTypes() {
    }

    static DataType toSpark(ColumnType type) {
        switch (type) {
            case LONG:
                return DataTypes.LongType;
            case INTEGER:
                return DataTypes.IntegerType;
            case DOUBLE:
                return DataTypes.DoubleType;
            case BOOLEAN:
                return DataTypes.BooleanType;
            default:
                return DataTypes.StringType;
        }
    }

    static ColumnType fromSpark(StructField field) {
        DataType type = field.dataType();
        if (DataTypes.StringType.equals(type)) {
            return ColumnType.STRING;
        }
        if (DataTypes.LongType.equals(type)) {
            return ColumnType.LONG;
        }
        if (DataTypes.IntegerType.equals(type)) {
            return ColumnType.INTEGER;
        }
        if (DataTypes.DoubleType.equals(type) || DataTypes.FloatType.equals(type)) {
            return ColumnType.DOUBLE;
        }
        if (DataTypes.BooleanType.equals(type)) {
            return ColumnType.BOOLEAN;
        }
        throw new SchemaException("Column '" + field.name() + "' has unsupported type " + type.simpleString());
    }

    static RowSchema toRowSchema(StructType struct) {
        List<Column> columns = new ArrayList<>();
        for (StructField field : struct.fields()) {
            columns.add(Column.of(field.name(), fromSpark(field)));
        }
        return new RowSchema(columns);
    }
}
