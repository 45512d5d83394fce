package com.logstuff.ingestion;

import com.logstuff.storage.LogEvent;

/**
 * Turns one input line into an event ready for insertion.
 */
public interface EventDecoder {

    /**
     * @param line a single non-blank input line
     * @return the event with its timestamp, document and full-text search text
     * @throws EventDecodeException if the line is not a valid event
     */
    LogEvent decode(String line) throws EventDecodeException;

    /**
     * Name used in configuration ({@code logstuff.ingest.format}).
     */
    String getFormat();
}
