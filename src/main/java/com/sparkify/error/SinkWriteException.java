package com.sparkify.error;

/**
 * A row-set could not be persisted to its output location.
 */
public class SinkWriteException extends EtlException {

    private final String path;

    public SinkWriteException(String path, String message, Throwable cause) {
        super("Cannot write '" + path + "': " + message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
