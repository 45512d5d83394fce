package com.logstuff.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.logstuff.search.FieldValueShare;
import com.logstuff.search.HistogramBucket;
import com.logstuff.search.SearchResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response of {@code GET /api/events}
 */
public class EventsResponse {
    @JsonProperty("events")
    private final List<EventView> events;

    @JsonProperty("fields")
    private final Map<String, Map<String, Double>> fields;

    @JsonProperty("counts")
    private final Map<String, Long> counts;

    @JsonProperty("metadata")
    private final Metadata metadata;

    @JsonProperty("next_cursor")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String nextCursor;

    public EventsResponse(List<EventView> events,
                          Map<String, Map<String, Double>> fields,
                          Map<String, Long> counts,
                          Metadata metadata,
                          String nextCursor) {
        this.events = events;
        this.fields = fields;
        this.counts = counts;
        this.metadata = metadata;
        this.nextCursor = nextCursor;
    }

    public static EventsResponse from(SearchResult result) {
        List<EventView> events = result.getPage().getEvents().stream()
            .map(EventView::of)
            .collect(Collectors.toList());

        Map<String, Map<String, Double>> fields = new LinkedHashMap<>();
        result.getTopFields().getFields().forEach((key, shares) -> {
            Map<String, Double> values = new LinkedHashMap<>();
            for (FieldValueShare share : shares) {
                values.put(share.getValue(), share.getPercentage());
            }
            fields.put(key, values);
        });

        Map<String, Long> counts = new LinkedHashMap<>();
        for (HistogramBucket bucket : result.getCounts()) {
            counts.put(bucket.getStart().toString(), bucket.getCount());
        }

        String cursor = result.getPage().getNextCursor() != null
            ? result.getPage().getNextCursor().encode()
            : null;
        return new EventsResponse(events, fields, counts,
            new Metadata(result.getPage().getTotalEstimate(), result.getHistogram().getWidthSeconds()),
            cursor);
    }

    public List<EventView> getEvents() {
        return events;
    }

    public Map<String, Map<String, Double>> getFields() {
        return fields;
    }

    public Map<String, Long> getCounts() {
        return counts;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public String getNextCursor() {
        return nextCursor;
    }

    public static class Metadata {
        /** Planner estimate, not an exact count */
        @JsonProperty("event_count")
        private final long eventCount;

        @JsonProperty("counts_interval_sec")
        private final double countsIntervalSec;

        public Metadata(long eventCount, double countsIntervalSec) {
            this.eventCount = eventCount;
            this.countsIntervalSec = countsIntervalSec;
        }

        public long getEventCount() {
            return eventCount;
        }

        public double getCountsIntervalSec() {
            return countsIntervalSec;
        }
    }
}
