package com.sparkify.ingestion;

import org.apache.hadoop.conf.Configuration;
import org.apache.spark.sql.SparkSession;

/**
 * Creates the Spark session the job runs on and hands it the S3 credentials.
 */
public final class SparkSessions {

    private SparkSessions() {
    }

    public static SparkSession create(EtlConfig config) {
        EtlConfig.SparkSettings settings = config.getSpark();
        SparkSession.Builder builder = SparkSession.builder()
                .appName(settings.getAppName())
                .config("spark.sql.session.timeZone", config.zoneId().getId());

        if (settings.getMaster() != null && !settings.getMaster().isEmpty()) {
            builder = builder.master(settings.getMaster());
        }
        if (settings.getPackages() != null && !settings.getPackages().isEmpty()) {
            builder = builder.config("spark.jars.packages", settings.getPackages());
        }

        SparkSession spark = builder.getOrCreate();
        spark.sparkContext().setLogLevel("WARN");
        applyCredentials(spark.sparkContext().hadoopConfiguration(), config.getAws());
        return spark;
    }

    static void applyCredentials(Configuration hadoopConf, EtlConfig.AwsCredentials aws) {
        if (aws == null || !aws.isComplete()) {
            return;
        }
        hadoopConf.set("fs.s3a.access.key", aws.getAccessKeyId());
        hadoopConf.set("fs.s3a.secret.key", aws.getSecretAccessKey());
    }
}
