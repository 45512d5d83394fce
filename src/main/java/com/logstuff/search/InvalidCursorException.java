package com.logstuff.search;

/**
 * Thrown when a paging cursor was not produced by this service or has been tampered with.
 */
public class InvalidCursorException extends IllegalArgumentException {

    public InvalidCursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
