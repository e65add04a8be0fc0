package com.sparkify.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sparkify.error.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Job settings, read from a YAML file ({@code dl.yml} by default).
 *
 * <pre>{@code
 * aws:
 *   access_key_id: AKIA...
 *   secret_access_key: ...
 * input_data: s3a://udacity-dend/
 * output_data: s3a://atr-udacity-dend/
 * time_zone: UTC
 * engine: spark
 * spark:
 *   app_name: SparkifyDataLake
 *   packages: org.apache.hadoop:hadoop-aws:3.3.4
 * }</pre>
 *
 * <p>{@code time_zone} decides the calendar fields of the time dimension and of the
 * songplays partitions; {@code SYSTEM} uses the JVM's default zone.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EtlConfig {

    public static final String DEFAULT_FILE = "dl.yml";
    public static final String DEFAULT_INPUT_DATA = "s3a://udacity-dend/";
    public static final String DEFAULT_OUTPUT_DATA = "s3a://atr-udacity-dend/";
    public static final String SYSTEM_ZONE = "SYSTEM";

    public static final String ENGINE_SPARK = "spark";
    public static final String ENGINE_MEMORY = "memory";

    @JsonProperty("aws")
    private AwsCredentials aws = new AwsCredentials();

    @JsonProperty("input_data")
    private String inputData = DEFAULT_INPUT_DATA;

    @JsonProperty("output_data")
    private String outputData = DEFAULT_OUTPUT_DATA;

    @JsonProperty("time_zone")
    private String timeZone = "UTC";

    @JsonProperty("engine")
    private String engine = ENGINE_SPARK;

    @JsonProperty("spark")
    private SparkSettings spark = new SparkSettings();

    public static EtlConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file.toAbsolutePath());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        EtlConfig config;
        try {
            config = mapper.readValue(file.toFile(), EtlConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot parse configuration " + file + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new EtlConfig();
        }
        config.validate();
        return config;
    }

    /**
     * Fails fast on settings the run cannot start without. Credentials are only demanded
     * when one of the locations lives on S3.
     */
    public void validate() {
        if (isBlank(inputData) || isBlank(outputData)) {
            throw new ConfigurationException("input_data and output_data must be set");
        }
        if (!ENGINE_SPARK.equals(engine) && !ENGINE_MEMORY.equals(engine)) {
            throw new ConfigurationException("Unknown engine '" + engine + "', expected spark or memory");
        }
        zoneId();
        if (ENGINE_MEMORY.equals(engine) && (!isLocal(inputData) || !isLocal(outputData))) {
            throw new ConfigurationException("The memory engine only handles local paths, got input_data '"
                    + inputData + "' and output_data '" + outputData + "'");
        }
        if ((isS3(inputData) || isS3(outputData)) && !aws.isComplete()) {
            throw new ConfigurationException(
                    "aws.access_key_id and aws.secret_access_key are required for S3 locations");
        }
    }

    public ZoneId zoneId() {
        if (isBlank(timeZone)) {
            throw new ConfigurationException("time_zone must not be empty");
        }
        if (SYSTEM_ZONE.equalsIgnoreCase(timeZone)) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid time_zone '" + timeZone + "'", e);
        }
    }

    static boolean isS3(String location) {
        return location.startsWith("s3a://") || location.startsWith("s3://") || location.startsWith("s3n://");
    }

    static boolean isLocal(String location) {
        return location.startsWith("file:") || !location.contains("://");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public AwsCredentials getAws() {
        return aws;
    }

    public void setAws(AwsCredentials aws) {
        this.aws = aws;
    }

    public String getInputData() {
        return inputData;
    }

    public void setInputData(String inputData) {
        this.inputData = inputData;
    }

    public String getOutputData() {
        return outputData;
    }

    public void setOutputData(String outputData) {
        this.outputData = outputData;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    public SparkSettings getSpark() {
        return spark;
    }

    public void setSpark(SparkSettings spark) {
        this.spark = spark;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AwsCredentials {

        @JsonProperty("access_key_id")
        private String accessKeyId;

        @JsonProperty("secret_access_key")
        private String secretAccessKey;

        public AwsCredentials() {}

        public AwsCredentials(String accessKeyId, String secretAccessKey) {
            this.accessKeyId = accessKeyId;
            this.secretAccessKey = secretAccessKey;
        }

        public boolean isComplete() {
            return !isBlank(accessKeyId) && !isBlank(secretAccessKey);
        }

        public String getAccessKeyId() { return accessKeyId; }
        public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

        public String getSecretAccessKey() { return secretAccessKey; }
        public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

        @Override
        public String toString() {
            return "AwsCredentials{accessKeyId=" + (accessKeyId == null ? null : "****") + "}";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SparkSettings {

        @JsonProperty("app_name")
        private String appName = "SparkifyDataLake";

        // empty: spark-submit decides
        @JsonProperty("master")
        private String master;

        @JsonProperty("packages")
        private String packages = "org.apache.hadoop:hadoop-aws:3.3.4";

        public String getAppName() { return appName; }
        public void setAppName(String appName) { this.appName = appName; }

        public String getMaster() { return master; }
        public void setMaster(String master) { this.master = master; }

        public String getPackages() { return packages; }
        public void setPackages(String packages) { this.packages = packages; }
    }
}
