package com.logstuff.api;

import com.logstuff.LogstuffApplication;
import com.logstuff.search.EventSearchService;
import com.logstuff.search.PageRequest;
import com.logstuff.search.SearchCursor;
import com.logstuff.search.SearchRequest;
import com.logstuff.search.SortOrder;
import com.logstuff.search.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Read API over the event store.
 * GET /api/events?start=..&end=..&query=..
 * GET /api/events/follow?query=..&after_id=..
 */
@RestController
@RequestMapping("/api")
@Profile("!" + LogstuffApplication.MODE_INGEST)
public class EventsController {
    private static final Logger log = LoggerFactory.getLogger(EventsController.class);

    static final String DEFAULT_FOLLOW_AGE = "PT1H";
    static final int DEFAULT_FOLLOW_LIMIT = 1000;

    private final EventSearchService searchService;

    public EventsController(EventSearchService searchService) {
        this.searchService = searchService;
    }

    /**
     * Events matching {@code query} in {@code [start, end)}, with top field values and counts per
     * time bucket over the same matches.
     *
     * @param start range start, ISO-8601 with offset
     * @param end range end (exclusive)
     * @param query LQL filter, empty for every event
     * @param limit page size, 1 to 10000
     * @param cursor {@code next_cursor} of the previous page
     * @param order {@code desc} (most recent first) or {@code asc}
     * @param buckets histogram bucket count; a round bucket width is chosen when absent
     */
    @GetMapping(value = "/events", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<EventsResponse> events(
            @RequestParam("start") String start,
            @RequestParam("end") String end,
            @RequestParam(value = "query", required = false) String query,
            @RequestParam(value = "limit", defaultValue = "" + PageRequest.DEFAULT_LIMIT) int limit,
            @RequestParam(value = "cursor", required = false) String cursor,
            @RequestParam(value = "order", required = false) String order,
            @RequestParam(value = "buckets", required = false) Integer buckets) {

        TimeRange range = new TimeRange(parseInstant("start", start), parseInstant("end", end));
        SearchCursor position = cursor == null || cursor.isBlank() ? null : SearchCursor.decode(cursor);
        PageRequest page = new PageRequest(limit, SortOrder.fromParameter(order), position);
        SearchRequest request = new SearchRequest(query, range, page, buckets);
        log.debug("Search {} in {} (limit {}, order {})", query, range, limit, page.getOrder());

        return searchService.search(request).map(EventsResponse::from);
    }

    /**
     * New events for tailing clients: poll with the returned {@code last_id} as {@code after_id}.
     *
     * @param query LQL filter, empty for every event
     * @param afterId only events with a greater id, 0 on the first poll
     * @param maxAge only events at most this old, ISO-8601 duration
     * @param limit most recent matches returned per poll
     */
    @GetMapping(value = "/events/follow", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<FollowResponse> follow(
            @RequestParam(value = "query", required = false) String query,
            @RequestParam(value = "after_id", defaultValue = "0") long afterId,
            @RequestParam(value = "max_age", defaultValue = DEFAULT_FOLLOW_AGE) String maxAge,
            @RequestParam(value = "limit", defaultValue = "" + DEFAULT_FOLLOW_LIMIT) int limit) {

        Duration age = parseDuration("max_age", maxAge);
        log.debug("Follow {} after id {} (max age {}, limit {})", query, afterId, age, limit);

        return searchService.follow(query, afterId, age, limit)
            .map(events -> FollowResponse.from(events, afterId));
    }

    static Duration parseDuration(String name, String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value
                + " (expected an ISO-8601 duration such as PT1H)", e);
        }
    }

    static Instant parseInstant(String name, String value) {
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value
                + " (expected an ISO-8601 timestamp with offset)", e);
        }
    }
}
