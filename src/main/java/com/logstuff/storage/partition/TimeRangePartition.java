package com.logstuff.storage.partition;

import java.util.Objects;

/**
 * Subdivision of the previous level into {@code interval}-wide partitions named by a template.
 */
public final class TimeRangePartition implements PartitionLevel {

    private final NameTemplate nameTemplate;
    private final Interval interval;

    public TimeRangePartition(NameTemplate nameTemplate, Interval interval) {
        this.nameTemplate = Objects.requireNonNull(nameTemplate, "nameTemplate");
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    public TimeRangePartition(String nameTemplate, Interval interval) {
        this(NameTemplate.parse(nameTemplate), interval);
    }

    public NameTemplate getNameTemplate() {
        return nameTemplate;
    }

    public Interval getInterval() {
        return interval;
    }

    @Override
    public String describe() {
        return interval.name().toLowerCase() + " partitions " + nameTemplate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRangePartition)) return false;
        TimeRangePartition that = (TimeRangePartition) o;
        return nameTemplate.equals(that.nameTemplate) && interval == that.interval;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nameTemplate, interval);
    }
}
