package com.sparkify.error;

/**
 * Raw records could not be located or parsed at a path pattern.
 */
public class SourceReadException extends EtlException {

    private final String path;

    public SourceReadException(String path, String message) {
        super("Cannot read '" + path + "': " + message);
        this.path = path;
    }

    public SourceReadException(String path, String message, Throwable cause) {
        super("Cannot read '" + path + "': " + message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
