package com.logstuff.search;

import java.time.Instant;

public class HistogramBucket {
    private final Instant start;
    private final long count;

    public HistogramBucket(Instant start, long count) {
        this.start = start;
        this.count = count;
    }

    public Instant getStart() {
        return start;
    }

    public long getCount() {
        return count;
    }

    @Override
    public String toString() {
        return start + "=" + count;
    }
}
