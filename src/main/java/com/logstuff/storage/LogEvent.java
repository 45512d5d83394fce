package com.logstuff.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored log event: server assigned id, event time, the JSON document and the text
 * the full-text index is built from. The id is null until the event is inserted, and the
 * search text is not read back on queries.
 */
public class LogEvent {
    private final Long id;
    private final Instant timestamp;
    private final ObjectNode doc;
    private final String search;

    public LogEvent(Long id, Instant timestamp, ObjectNode doc, String search) {
        this.id = id;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.doc = Objects.requireNonNull(doc, "doc");
        this.search = search;
    }

    public static LogEvent unsaved(Instant timestamp, ObjectNode doc, String search) {
        return new LogEvent(null, timestamp, doc, search);
    }

    public Long getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ObjectNode getDoc() {
        return doc;
    }

    public String getSearch() {
        return search;
    }

    @Override
    public String toString() {
        return "LogEvent{id=" + id + ", timestamp=" + timestamp + ", doc=" + doc + "}";
    }
}
