package com.logstuff.storage.partition;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Half-open time range {@code [lower, upper)} covered by one partition.
 */
public final class TimeBucket {

    private static final DateTimeFormatter BOUND_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

    private final ZonedDateTime lower;
    private final ZonedDateTime upper;

    public TimeBucket(ZonedDateTime lower, ZonedDateTime upper) {
        if (!lower.isBefore(upper)) {
            throw new IllegalArgumentException("Empty bucket: " + lower + " to " + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }

    public ZonedDateTime getLower() {
        return lower;
    }

    public ZonedDateTime getUpper() {
        return upper;
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(lower.toInstant()) && instant.isBefore(upper.toInstant());
    }

    /**
     * Lower bound as a PostgreSQL timestamptz literal, e.g. {@code 2024-03-01 00:00:00+00:00}.
     */
    public String lowerLiteral() {
        return BOUND_FORMAT.format(lower);
    }

    public String upperLiteral() {
        return BOUND_FORMAT.format(upper);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeBucket)) return false;
        TimeBucket that = (TimeBucket) o;
        return lower.toInstant().equals(that.lower.toInstant()) && upper.toInstant().equals(that.upper.toInstant());
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower.toInstant(), upper.toInstant());
    }

    @Override
    public String toString() {
        return "[" + lowerLiteral() + ", " + upperLiteral() + ")";
    }
}
