package com.tx.insights.dataset;

/**
 * Thrown when a dataset file cannot be read or holds an invalid entry.
 */
public class DatasetException extends RuntimeException {

    public DatasetException(String message) {
        super(message);
    }

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
