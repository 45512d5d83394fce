package com.logstuff.search;

/**
 * Page size, order and optional keyset position of a search.
 */
public class PageRequest {

    public static final int DEFAULT_LIMIT = 500;
    public static final int MAX_LIMIT = 10000;

    private final int limit;
    private final SortOrder order;
    private final SearchCursor cursor;

    public PageRequest(int limit, SortOrder order, SearchCursor cursor) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
        this.limit = limit;
        this.order = order != null ? order : SortOrder.DESC;
        this.cursor = cursor;
    }

    public static PageRequest first(int limit) {
        return new PageRequest(limit, SortOrder.DESC, null);
    }

    public int getLimit() {
        return limit;
    }

    public SortOrder getOrder() {
        return order;
    }

    /**
     * Position after which this page starts, or null for the first page.
     */
    public SearchCursor getCursor() {
        return cursor;
    }
}
