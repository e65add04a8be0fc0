package com.sparkify.engine.spark;

import com.sparkify.engine.RowSetEngine;
import com.sparkify.error.EtlException;
import com.sparkify.error.SinkWriteException;
import com.sparkify.error.SourceReadException;
import com.sparkify.rowset.RowSet;

import org.apache.spark.sql.DataFrameReader;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Engine delegating to a {@link SparkSession}. Works against any file system Hadoop can reach,
 * {@code s3a://} included when the hadoop-aws package is on the classpath.
 */
public class SparkEngine implements RowSetEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SparkEngine.class);

    private final SparkSession spark;

    public SparkEngine(SparkSession spark) {
        this.spark = spark;
    }

    @Override
    public RowSet read(String path) {
        DataFrameReader reader = spark.read().option("mode", "FAILFAST");
        if (!isGlob(path)) {
            reader = reader.option("recursiveFileLookup", "true");
        }
        try {
            Dataset<Row> df = reader.json(path);
            LOGGER.info("Reading JSON from {} with columns {}", path, (Object) df.columns());
            return new SparkRowSet(df);
        } catch (EtlException e) {
            throw e;
        } catch (Exception e) {
            throw new SourceReadException(path, e.getMessage(), e);
        }
    }

    @Override
    public void write(RowSet rows, String path, List<String> partitionColumns) {
        rows.schema().require(partitionColumns.toArray(new String[0]));
        Dataset<Row> df = SparkRowSet.adopt(rows, spark).dataset();
        try {
            df.write()
                    .mode(SaveMode.Overwrite)
                    .partitionBy(partitionColumns.toArray(new String[0]))
                    .parquet(path);
            LOGGER.info("Wrote {} partitioned by {}", path, partitionColumns);
        } catch (Exception e) {
            throw new SinkWriteException(path, e.getMessage(), e);
        }
    }

    @Override
    public RowSet readParquet(String path) {
        try {
            return new SparkRowSet(spark.read().parquet(path));
        } catch (Exception e) {
            throw new SourceReadException(path, e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "spark";
    }

    @Override
    public void close() {
        spark.stop();
    }

    private static boolean isGlob(String path) {
        return path.indexOf('*') >= 0 || path.indexOf('?') >= 0
                || path.indexOf('[') >= 0 || path.indexOf('{') >= 0;
    }
}
