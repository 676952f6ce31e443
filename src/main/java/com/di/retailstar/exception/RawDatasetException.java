package com.di.retailstar.exception;

/**
 * The raw extract could not be read (missing file, malformed CSV).
 */
public class RawDatasetException extends RuntimeException {

    public RawDatasetException(String message) {
        super(message);
    }

    public RawDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
