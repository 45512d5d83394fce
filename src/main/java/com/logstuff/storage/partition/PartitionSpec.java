package com.logstuff.storage.partition;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered partition hierarchy: the root table followed by zero or more time range levels,
 * each partitioning the previous one. Names are formatted in {@link #getZone()}.
 *
 * <p>Use {@link PartitionSpecValidator} before routing with a spec.
 */
public final class PartitionSpec {

    private final List<PartitionLevel> levels;
    private final ZoneId zone;

    public PartitionSpec(List<PartitionLevel> levels, ZoneId zone) {
        this.levels = List.copyOf(levels);
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static PartitionSpec of(RootPartition root, TimeRangePartition... timeRanges) {
        List<PartitionLevel> levels = new ArrayList<>();
        levels.add(root);
        levels.addAll(List.of(timeRanges));
        return new PartitionSpec(levels, ZoneOffset.UTC);
    }

    public List<PartitionLevel> getLevels() {
        return levels;
    }

    public ZoneId getZone() {
        return zone;
    }

    public RootPartition getRoot() {
        if (levels.isEmpty() || !(levels.get(0) instanceof RootPartition)) {
            throw new PartitionResolutionException("Partition spec must start with a root entry");
        }
        return (RootPartition) levels.get(0);
    }

    public List<TimeRangePartition> getTimeRanges() {
        List<TimeRangePartition> ranges = new ArrayList<>();
        for (PartitionLevel level : levels.subList(Math.min(1, levels.size()), levels.size())) {
            if (!(level instanceof TimeRangePartition)) {
                throw new PartitionResolutionException("Only the first partition entry may be a root: "
                    + level.describe());
            }
            ranges.add((TimeRangePartition) level);
        }
        return ranges;
    }

    public PartitionSpec withZone(ZoneId otherZone) {
        return new PartitionSpec(levels, otherZone);
    }
}
