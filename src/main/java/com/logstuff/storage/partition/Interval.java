package com.logstuff.storage.partition;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Width of a time range partition, from coarsest to finest.
 */
public enum Interval {
    YEAR,
    QUARTER,
    MONTH,
    WEEK,
    DAY,
    HOUR,
    MINUTE;

    /**
     * Start of the bucket containing {@code time}. Weeks start on the ISO Monday.
     */
    public ZonedDateTime truncate(ZonedDateTime time) {
        return switch (this) {
            case YEAR -> time.withDayOfYear(1).truncatedTo(ChronoUnit.DAYS);
            case QUARTER -> time.withDayOfMonth(1)
                .withMonth((time.getMonthValue() - 1) / 3 * 3 + 1)
                .truncatedTo(ChronoUnit.DAYS);
            case MONTH -> time.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
            case WEEK -> time.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case DAY -> time.truncatedTo(ChronoUnit.DAYS);
            case HOUR -> time.truncatedTo(ChronoUnit.HOURS);
            case MINUTE -> time.truncatedTo(ChronoUnit.MINUTES);
        };
    }

    /**
     * Start of the bucket following the one that starts at {@code lower}.
     */
    public ZonedDateTime next(ZonedDateTime lower) {
        ZonedDateTime later = switch (this) {
            case YEAR -> lower.plusYears(1);
            case QUARTER -> lower.plusMonths(3);
            case MONTH -> lower.plusMonths(1);
            case WEEK -> lower.plusWeeks(1);
            case DAY -> lower.plusDays(1);
            case HOUR -> lower.plusHours(1);
            case MINUTE -> lower.plusMinutes(1);
        };
        // Re-truncate in case the lower bound was shifted by a DST gap at midnight
        return truncate(later);
    }

    public TimeBucket bucketOf(Instant instant, ZoneId zone) {
        ZonedDateTime lower = truncate(instant.atZone(zone));
        return new TimeBucket(lower, next(lower));
    }

    /**
     * Whether partitions of this interval can subdivide partitions of {@code parent}.
     * The child must be finer, and weeks only nest in weeks' multiples, so never in
     * months, quarters or years.
     */
    public boolean nestsWithin(Interval parent) {
        if (ordinal() <= parent.ordinal()) {
            return false;
        }
        return !(this == WEEK && parent.ordinal() < WEEK.ordinal());
    }
}
