package com.logstuff.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logstuff.storage.LogEvent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response of {@code GET /api/events/follow}; {@code last_id} is the {@code after_id} of the next poll.
 */
public class FollowResponse {
    @JsonProperty("events")
    private final List<EventView> events;

    @JsonProperty("last_id")
    private final long lastId;

    public FollowResponse(List<EventView> events, long lastId) {
        this.events = events;
        this.lastId = lastId;
    }

    public static FollowResponse from(List<LogEvent> events, long afterId) {
        long lastId = afterId;
        for (LogEvent event : events) {
            lastId = Math.max(lastId, event.getId());
        }
        return new FollowResponse(events.stream().map(EventView::of).collect(Collectors.toList()), lastId);
    }

    public List<EventView> getEvents() {
        return events;
    }

    public long getLastId() {
        return lastId;
    }
}
