package com.logstuff.search;

import com.logstuff.storage.LogEvent;

import java.util.List;

/**
 * One page of matching events with the planner's estimate of all matches in the range.
 */
public class EventPage {

    public static final long UNKNOWN_ESTIMATE = -1;

    private final List<LogEvent> events;
    private final long totalEstimate;
    private final SearchCursor nextCursor;

    public EventPage(List<LogEvent> events, long totalEstimate, SearchCursor nextCursor) {
        this.events = List.copyOf(events);
        this.totalEstimate = totalEstimate;
        this.nextCursor = nextCursor;
    }

    public EventPage withTotalEstimate(long estimate) {
        return new EventPage(events, estimate, nextCursor);
    }

    public List<LogEvent> getEvents() {
        return events;
    }

    /**
     * Approximate number of matching events, never an exact count. {@link #UNKNOWN_ESTIMATE}
     * when it was not requested.
     */
    public long getTotalEstimate() {
        return totalEstimate;
    }

    /**
     * Cursor of the following page, or null when this page is the last one.
     */
    public SearchCursor getNextCursor() {
        return nextCursor;
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
