package com.logstuff.ingestion;

/**
 * What happened to one input line. Every outcome except {@link #IGNORED} is confirmed.
 */
public enum LineOutcome {
    /** Stored in its partition. */
    INSERTED,
    /** Undecodable or refused by the database; confirmed so it is not redelivered. */
    REJECTED,
    /** Blank line, not an event. */
    IGNORED;

    public boolean isConfirmed() {
        return this != IGNORED;
    }
}
