package com.logstuff.search;

import java.util.List;

public class SearchResult {
    private final EventPage page;
    private final TopFields topFields;
    private final List<HistogramBucket> counts;
    private final HistogramSpec histogram;

    public SearchResult(EventPage page, TopFields topFields, List<HistogramBucket> counts, HistogramSpec histogram) {
        this.page = page;
        this.topFields = topFields;
        this.counts = List.copyOf(counts);
        this.histogram = histogram;
    }

    public EventPage getPage() {
        return page;
    }

    public TopFields getTopFields() {
        return topFields;
    }

    public List<HistogramBucket> getCounts() {
        return counts;
    }

    public HistogramSpec getHistogram() {
        return histogram;
    }
}
