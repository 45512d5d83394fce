package com.logstuff.search;

/**
 * A search as asked for by a client: LQL query, time range, page and histogram layout.
 */
public class SearchRequest {
    private final String query;
    private final TimeRange range;
    private final PageRequest page;
    private final Integer buckets;

    /**
     * @param query LQL text, blank to match every event in the range
     * @param buckets histogram bucket count, or null for a round bucket width
     */
    public SearchRequest(String query, TimeRange range, PageRequest page, Integer buckets) {
        this.query = query;
        this.range = range;
        this.page = page;
        this.buckets = buckets;
    }

    public String getQuery() {
        return query;
    }

    public TimeRange getRange() {
        return range;
    }

    public PageRequest getPage() {
        return page;
    }

    public Integer getBuckets() {
        return buckets;
    }

    public HistogramSpec histogramSpec() {
        return buckets != null ? HistogramSpec.equalWidth(range, buckets) : HistogramSpec.niceInterval(range);
    }
}
