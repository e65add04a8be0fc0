package com.sparkify.error;

/**
 * Base class for every failure raised by the ETL job. None of them are recovered locally:
 * they travel up to {@code SparkifyEtlPipeline.main}, which logs them and exits non-zero.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
