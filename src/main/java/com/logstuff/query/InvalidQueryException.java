package com.logstuff.query;

/**
 * Base class for query errors detected before any SQL is issued.
 * The query is rejected and never retried.
 */
public abstract class InvalidQueryException extends RuntimeException {

    private final String query;

    protected InvalidQueryException(String message, String query) {
        super(message);
        this.query = query;
    }

    protected InvalidQueryException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    /**
     * Short machine readable error code reported to API clients.
     */
    public abstract String getErrorCode();

    public String getQuery() {
        return query;
    }
}
