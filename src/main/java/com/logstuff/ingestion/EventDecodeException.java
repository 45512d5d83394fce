package com.logstuff.ingestion;

/**
 * Exception thrown when an input line cannot be turned into an event.
 * Such a line can never succeed on redelivery, so it is logged and confirmed.
 */
public class EventDecodeException extends RuntimeException {

    private final String rawData;

    public EventDecodeException(String message, String rawData) {
        super(message);
        this.rawData = rawData;
    }

    public EventDecodeException(String message, String rawData, Throwable cause) {
        super(message, cause);
        this.rawData = rawData;
    }

    public String getRawData() {
        return rawData;
    }
}
