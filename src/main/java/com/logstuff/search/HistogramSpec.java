package com.logstuff.search;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Bucket layout of an event count histogram: {@code bucketCount} buckets of equal
 * {@code width}, the i-th covering {@code [origin + i*width, origin + (i+1)*width)}.
 */
public final class HistogramSpec {

    public static final int MAX_BUCKETS = 10000;

    /** Upper bound (exclusive) on the bucket count {@link #niceInterval} aims for. */
    static final int NICE_BUCKET_LIMIT = 100;

    private static final Duration YEAR = Duration.ofDays(365);

    static final List<Duration> NICE_WIDTHS = List.of(
        Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(5),
        Duration.ofSeconds(10), Duration.ofSeconds(30),
        Duration.ofMinutes(1), Duration.ofMinutes(2), Duration.ofMinutes(5),
        Duration.ofMinutes(10), Duration.ofMinutes(30),
        Duration.ofHours(1), Duration.ofHours(2), Duration.ofHours(5), Duration.ofHours(10),
        Duration.ofDays(1), Duration.ofDays(2), Duration.ofDays(7), Duration.ofDays(14),
        Duration.ofDays(30), Duration.ofDays(60), Duration.ofDays(90), Duration.ofDays(120),
        Duration.ofDays(180), YEAR, YEAR.multipliedBy(2), YEAR.multipliedBy(5),
        YEAR.multipliedBy(10), YEAR.multipliedBy(20), YEAR.multipliedBy(50));

    private final Instant origin;
    private final Duration width;
    private final int bucketCount;

    HistogramSpec(Instant origin, Duration width, int bucketCount) {
        if (width.toMillis() < 1) {
            throw new IllegalArgumentException("Bucket width must be at least 1 ms: " + width);
        }
        if (bucketCount < 1 || bucketCount > MAX_BUCKETS) {
            throw new IllegalArgumentException("Bucket count must be between 1 and " + MAX_BUCKETS + ": " + bucketCount);
        }
        this.origin = origin;
        this.width = width;
        this.bucketCount = bucketCount;
    }

    /**
     * {@code buckets} equal buckets starting at the range start. The width is rounded up to whole
     * milliseconds, so the last bucket may end after the range.
     */
    public static HistogramSpec equalWidth(TimeRange range, int buckets) {
        if (buckets < 1 || buckets > MAX_BUCKETS) {
            throw new IllegalArgumentException("Bucket count must be between 1 and " + MAX_BUCKETS + ": " + buckets);
        }
        long widthMillis = Math.max(1, ceilDiv(range.getDuration().toMillis(), buckets));
        return new HistogramSpec(range.getStart(), Duration.ofMillis(widthMillis), buckets);
    }

    /**
     * The smallest round width giving fewer than 100 buckets, with buckets aligned to multiples
     * of the width since the epoch.
     */
    public static HistogramSpec niceInterval(TimeRange range) {
        HistogramSpec spec = null;
        for (Duration width : NICE_WIDTHS) {
            spec = aligned(range, width);
            if (spec.bucketCount < NICE_BUCKET_LIMIT) {
                return spec;
            }
        }
        return spec;
    }

    static HistogramSpec aligned(TimeRange range, Duration width) {
        long widthMillis = width.toMillis();
        long originMillis = Math.floorDiv(range.getStart().toEpochMilli(), widthMillis) * widthMillis;
        long count = ceilDiv(range.getEnd().toEpochMilli() - originMillis, widthMillis);
        return new HistogramSpec(Instant.ofEpochMilli(originMillis), width, (int) Math.min(count, MAX_BUCKETS));
    }

    private static long ceilDiv(long dividend, long divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }

    public Instant getOrigin() {
        return origin;
    }

    public Duration getWidth() {
        return width;
    }

    public int getBucketCount() {
        return bucketCount;
    }

    public double getWidthSeconds() {
        return width.toMillis() / 1000.0;
    }

    public Instant bucketStart(int index) {
        return origin.plus(width.multipliedBy(index));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistogramSpec)) return false;
        HistogramSpec that = (HistogramSpec) o;
        return bucketCount == that.bucketCount && origin.equals(that.origin) && width.equals(that.width);
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin, width, bucketCount);
    }

    @Override
    public String toString() {
        return "HistogramSpec{origin=" + origin + ", width=" + width + ", buckets=" + bucketCount + "}";
    }
}
