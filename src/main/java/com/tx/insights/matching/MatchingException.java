package com.tx.insights.matching;

/**
 * Thrown when the parallel matching phase cannot complete.
 * Individual facts never raise; they resolve to no match instead.
 */
public class MatchingException extends RuntimeException {

    public MatchingException(String message) {
        super(message);
    }

    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
