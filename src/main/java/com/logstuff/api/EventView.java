package com.logstuff.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logstuff.storage.LogEvent;

/**
 * One event as returned by the read API: its id, time and the original document.
 */
public class EventView {
    @JsonProperty("id")
    private final long id;

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("source")
    private final ObjectNode source;

    public EventView(long id, String timestamp, ObjectNode source) {
        this.id = id;
        this.timestamp = timestamp;
        this.source = source;
    }

    public static EventView of(LogEvent event) {
        return new EventView(event.getId(), event.getTimestamp().toString(), event.getDoc());
    }

    public long getId() {
        return id;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public ObjectNode getSource() {
        return source;
    }
}
