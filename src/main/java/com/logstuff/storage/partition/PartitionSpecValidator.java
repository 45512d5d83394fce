package com.logstuff.storage.partition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Startup validation of a {@link PartitionSpec}.
 *
 * <p>Name templates are checked empirically: every level is formatted for a run of
 * consecutive buckets spanning more than a year, and the generated names must be valid
 * unquoted PostgreSQL identifiers, distinct for distinct buckets and never shared between
 * levels.
 */
public final class PartitionSpecValidator {
    private static final Logger logger = LoggerFactory.getLogger(PartitionSpecValidator.class);

    static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_$]*");
    static final int MAX_IDENTIFIER_BYTES = 63;

    // Crosses a leap day, ISO week-year boundaries and several calendar years
    private static final LocalDateTime SAMPLE_START = LocalDateTime.of(2019, 12, 1, 0, 0);

    private PartitionSpecValidator() {
    }

    /**
     * @throws PartitionResolutionException describing the first problem found
     */
    public static void validate(PartitionSpec spec) {
        List<PartitionLevel> levels = spec.getLevels();
        if (levels.isEmpty()) {
            throw new PartitionResolutionException("Partition spec is empty");
        }
        RootPartition root = spec.getRoot();
        List<TimeRangePartition> timeRanges = spec.getTimeRanges();

        requireTableName(root.getTable(), null);
        if (root.getSchema().isBlank()) {
            throw new PartitionResolutionException("Root table " + root.getTable() + " has no column schema");
        }

        Map<String, String> owners = new HashMap<>();
        owners.put(root.getTable(), root.describe());

        Interval parent = null;
        for (TimeRangePartition range : timeRanges) {
            if (parent != null && !range.getInterval().nestsWithin(parent)) {
                throw new PartitionResolutionException("Interval " + range.getInterval()
                    + " cannot subdivide " + parent, range.getNameTemplate().getPattern());
            }
            Map<String, ZonedDateTime> names = sampleNames(range, spec.getZone());
            for (String name : names.keySet()) {
                String previous = owners.putIfAbsent(name, range.describe());
                if (previous != null) {
                    throw new PartitionResolutionException("Table name " + name + " is generated by both "
                        + previous + " and " + range.describe(), range.getNameTemplate().getPattern());
                }
            }
            parent = range.getInterval();
        }
        logger.info("Partition spec validated: root {} with {} time range level(s) in zone {}",
            root.getTable(), timeRanges.size(), spec.getZone());
    }

    /**
     * Names generated for a sample of buckets, with the bucket each came from.
     */
    static Map<String, ZonedDateTime> sampleNames(TimeRangePartition range, ZoneId zone) {
        NameTemplate template = range.getNameTemplate();
        Map<String, ZonedDateTime> names = new LinkedHashMap<>();
        for (ZonedDateTime lower : sampleLowerBounds(range.getInterval(), zone)) {
            String name = template.format(lower);
            requireTableName(name, template);
            ZonedDateTime previous = names.putIfAbsent(name, lower);
            if (previous != null && !previous.toInstant().equals(lower.toInstant())) {
                throw new PartitionResolutionException("Buckets starting " + previous + " and " + lower
                    + " both map to table " + name, template.getPattern());
            }
        }
        return names;
    }

    /**
     * Consecutive bucket starts covering more than a year. Minutes are sampled densely for a
     * week and then at every hour, which still exposes a template missing any field.
     */
    static List<ZonedDateTime> sampleLowerBounds(Interval interval, ZoneId zone) {
        ZonedDateTime start = interval.truncate(SAMPLE_START.atZone(zone));
        List<ZonedDateTime> bounds = new ArrayList<>();
        int count = switch (interval) {
            case YEAR -> 40;
            case QUARTER, MONTH -> 48;
            case WEEK -> 120;
            case DAY -> 800;
            case HOUR -> 400 * 24;
            case MINUTE -> 8 * 24 * 60;
        };
        ZonedDateTime lower = start;
        for (int i = 0; i < count; i++) {
            bounds.add(lower);
            lower = interval.next(lower);
        }
        if (interval == Interval.MINUTE) {
            ZonedDateTime hourly = Interval.HOUR.truncate(start);
            for (int i = 0; i < 400 * 24; i++) {
                bounds.add(hourly);
                hourly = Interval.HOUR.next(hourly);
            }
        }
        return bounds;
    }

    private static void requireTableName(String name, NameTemplate template) {
        String pattern = template != null ? template.getPattern() : null;
        if (!TABLE_NAME.matcher(name).matches()) {
            throw new PartitionResolutionException("Invalid table name '" + name
                + "': must match " + TABLE_NAME.pattern(), pattern);
        }
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_IDENTIFIER_BYTES) {
            throw new PartitionResolutionException("Table name '" + name + "' is longer than "
                + MAX_IDENTIFIER_BYTES + " bytes", pattern);
        }
    }
}
