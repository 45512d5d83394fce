package com.logstuff.config;

import com.logstuff.storage.partition.Interval;
import com.logstuff.storage.partition.NameTemplate;
import com.logstuff.storage.partition.PartitionLevel;
import com.logstuff.storage.partition.PartitionResolutionException;
import com.logstuff.storage.partition.PartitionSpec;
import com.logstuff.storage.partition.RootPartition;
import com.logstuff.storage.partition.TimeRangePartition;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured settings bound from the {@code logstuff} prefix.
 * Scalar settings are read with {@code @Value} where they are used.
 *
 * <pre>
 * logstuff:
 *   zone: UTC
 *   partitions:
 *     - kind: root
 *       table: logs
 *       schema: "id bigserial not null, tstamp timestamptz not null, doc jsonb not null, search tsvector"
 *     - kind: time-range
 *       name-template: logs_%Y_%m
 *       interval: month
 * </pre>
 */
@ConfigurationProperties("logstuff")
public class LogstuffProperties {

    private String mode = "serve";
    private ZoneId zone = ZoneOffset.UTC;
    private List<PartitionEntry> partitions = new ArrayList<>();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = zone;
    }

    public List<PartitionEntry> getPartitions() {
        return partitions;
    }

    public void setPartitions(List<PartitionEntry> partitions) {
        this.partitions = partitions;
    }

    /**
     * Build the partition spec described by {@link #getPartitions()}.
     *
     * @throws PartitionResolutionException if an entry is incomplete
     */
    public PartitionSpec toPartitionSpec() {
        if (partitions.isEmpty()) {
            throw new PartitionResolutionException("No partitions configured under logstuff.partitions");
        }
        List<PartitionLevel> levels = new ArrayList<>();
        for (int i = 0; i < partitions.size(); i++) {
            levels.add(partitions.get(i).toLevel(i));
        }
        return new PartitionSpec(levels, zone);
    }

    public static class PartitionEntry {

        public enum Kind {
            ROOT,
            TIME_RANGE
        }

        private Kind kind;
        private String table;
        private String schema;
        private String nameTemplate;
        private Interval interval;

        PartitionLevel toLevel(int index) {
            if (kind == null) {
                throw new PartitionResolutionException("logstuff.partitions[" + index + "].kind is required");
            }
            return switch (kind) {
                case ROOT -> {
                    if (table == null || schema == null) {
                        throw new PartitionResolutionException(
                            "logstuff.partitions[" + index + "] root needs table and schema");
                    }
                    yield new RootPartition(table, schema);
                }
                case TIME_RANGE -> {
                    if (nameTemplate == null || interval == null) {
                        throw new PartitionResolutionException(
                            "logstuff.partitions[" + index + "] time range needs name-template and interval");
                    }
                    yield new TimeRangePartition(NameTemplate.parse(nameTemplate), interval);
                }
            };
        }

        public Kind getKind() {
            return kind;
        }

        public void setKind(Kind kind) {
            this.kind = kind;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public String getNameTemplate() {
            return nameTemplate;
        }

        public void setNameTemplate(String nameTemplate) {
            this.nameTemplate = nameTemplate;
        }

        public Interval getInterval() {
            return interval;
        }

        public void setInterval(Interval interval) {
            this.interval = interval;
        }
    }
}
