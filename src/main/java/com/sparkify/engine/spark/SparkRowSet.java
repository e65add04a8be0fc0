package com.sparkify.engine.spark;

import com.sparkify.error.SchemaException;
import com.sparkify.rowset.Column;
import com.sparkify.rowset.ColumnType;
import com.sparkify.rowset.DataRow;
import com.sparkify.rowset.JoinKey;
import com.sparkify.rowset.Projection;
import com.sparkify.rowset.RowFunction;
import com.sparkify.rowset.RowSchema;
import com.sparkify.rowset.RowSet;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.api.java.UDF1;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;

import java.util.ArrayList;
import java.util.List;

import static org.apache.spark.sql.functions.col;
import static org.apache.spark.sql.functions.lit;
import static org.apache.spark.sql.functions.struct;
import static org.apache.spark.sql.functions.udf;

/**
 * Row-set backed by a Spark {@link Dataset}. Operations build up the logical plan; nothing
 * runs until the row-set is collected, counted or written.
 */
public final class SparkRowSet implements RowSet {

    private final Dataset<Row> dataset;
    private final RowSchema schema;

    public SparkRowSet(Dataset<Row> dataset) {
        this.dataset = dataset;
        this.schema = SparkTypes.toRowSchema(dataset.schema());
    }

    public Dataset<Row> dataset() {
        return dataset;
    }

    /**
     * Brings any row-set into Spark, so the two engines can be mixed in one plan.
     */
    static SparkRowSet adopt(RowSet rows, SparkSession spark) {
        if (rows instanceof SparkRowSet) {
            return (SparkRowSet) rows;
        }
        List<StructField> fields = new ArrayList<>();
        for (Column column : rows.columns()) {
            fields.add(DataTypes.createStructField(
                    column.getName(), SparkTypes.toSpark(column.getType()), true));
        }
        List<Row> data = new ArrayList<>();
        for (DataRow row : rows.collect()) {
            data.add(RowFactory.create(row.values()));
        }
        return new SparkRowSet(spark.createDataFrame(data, DataTypes.createStructType(fields)));
    }

    @Override
    public RowSchema schema() {
        return schema;
    }

    @Override
    public RowSet select(Projection... projections) {
        org.apache.spark.sql.Column[] columns = new org.apache.spark.sql.Column[projections.length];
        for (int i = 0; i < projections.length; i++) {
            schema.require(projections[i].getSource());
            columns[i] = col(projections[i].getSource()).alias(projections[i].getAlias());
        }
        return new SparkRowSet(dataset.select(columns));
    }

    @Override
    public RowSet filterEquals(String column, Object value) {
        Object expected = schema.column(column).getType().coerce(value);
        return new SparkRowSet(dataset.where(col(column).equalTo(lit(expected))));
    }

    @Override
    public RowSet distinct() {
        return new SparkRowSet(dataset.dropDuplicates());
    }

    @Override
    public RowSet withColumn(String name, ColumnType type, RowFunction function) {
        UserDefinedFunction derive = udf(
                (UDF1<Row, Object>) row -> type.coerce(function.apply(new SparkRowView(row))),
                SparkTypes.toSpark(type));

        String[] names = dataset.columns();
        org.apache.spark.sql.Column[] inputs = new org.apache.spark.sql.Column[names.length];
        for (int i = 0; i < names.length; i++) {
            inputs[i] = col(names[i]);
        }
        return new SparkRowSet(dataset.withColumn(name, derive.apply(struct(inputs))));
    }

    @Override
    public RowSet leftJoin(RowSet right, JoinKey... keys) {
        if (keys.length == 0) {
            throw new SchemaException("Join needs at least one key");
        }
        SparkRowSet other = adopt(right, dataset.sparkSession());
        for (String name : other.columnNames()) {
            if (schema.contains(name)) {
                throw new SchemaException("Column '" + name
                        + "' exists on both sides of the join; project one side first");
            }
        }

        org.apache.spark.sql.Column condition = null;
        for (JoinKey key : keys) {
            schema.require(key.getLeftColumn());
            other.schema().require(key.getRightColumn());
            org.apache.spark.sql.Column equal =
                    dataset.col(key.getLeftColumn()).equalTo(other.dataset.col(key.getRightColumn()));
            condition = condition == null ? equal : condition.and(equal);
        }
        return new SparkRowSet(dataset.join(other.dataset, condition, "left_outer"));
    }

    @Override
    public List<DataRow> collect() {
        List<DataRow> rows = new ArrayList<>();
        int width = schema.size();
        for (Row row : dataset.collectAsList()) {
            Object[] values = new Object[width];
            for (int i = 0; i < width; i++) {
                values[i] = row.get(i);
            }
            rows.add(new DataRow(schema, values));
        }
        return rows;
    }

    @Override
    public long count() {
        return dataset.count();
    }

    @Override
    public String toString() {
        return "SparkRowSet" + schema;
    }
}
