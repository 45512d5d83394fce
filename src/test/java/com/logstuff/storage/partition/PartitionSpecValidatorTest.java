package com.logstuff.storage.partition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PartitionSpecValidator
 */
class PartitionSpecValidatorTest {

    private static final RootPartition ROOT = new RootPartition("logs",
        "id bigserial not null, tstamp timestamptz not null, doc jsonb not null, search tsvector");

    @Test
    void testMonthlyPartitionsAreValid() {
        PartitionSpec spec = PartitionSpec.of(ROOT, new TimeRangePartition("logs_%Y_%m", Interval.MONTH));

        assertThatCode(() -> PartitionSpecValidator.validate(spec)).doesNotThrowAnyException();
    }

    @Test
    void testNestedLevelsAreValid() {
        PartitionSpec spec = PartitionSpec.of(ROOT,
            new TimeRangePartition("logs_%Y", Interval.YEAR),
            new TimeRangePartition("logs_%Y_%m", Interval.MONTH),
            new TimeRangePartition("logs_%Y_%m_%d", Interval.DAY));

        assertThatCode(() -> PartitionSpecValidator.validate(spec)).doesNotThrowAnyException();
    }

    @Test
    void testRootOnlyIsValid() {
        assertThatCode(() -> PartitionSpecValidator.validate(PartitionSpec.of(ROOT))).doesNotThrowAnyException();
    }

    @Test
    void testQuarterAndWeekTemplatesAreValid() {
        assertThatCode(() -> PartitionSpecValidator.validate(PartitionSpec.of(ROOT,
            new TimeRangePartition("logs_%Y_q%q", Interval.QUARTER)))).doesNotThrowAnyException();
        assertThatCode(() -> PartitionSpecValidator.validate(PartitionSpec.of(ROOT,
            new TimeRangePartition("logs_%G_w%V", Interval.WEEK)))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("A template coarser than its interval maps several buckets to one table")
    void testNonInjectiveTemplateIsRejected() {
        PartitionSpec spec = PartitionSpec.of(ROOT, new TimeRangePartition("logs_%Y", Interval.MONTH));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class)
            .hasMessageContaining("both map to table logs_2020")
            .hasMessageContaining("[Template: logs_%Y]");
    }

    @Test
    void testDayTemplateWithoutYearIsRejected() {
        PartitionSpec spec = PartitionSpec.of(ROOT, new TimeRangePartition("logs_%m_%d", Interval.DAY));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class);
    }

    @Test
    void testMinuteTemplateWithoutDayIsRejected() {
        PartitionSpec spec = PartitionSpec.of(ROOT, new TimeRangePartition("logs_%H%M", Interval.MINUTE));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class);
    }

    @Test
    void testInvalidIdentifierIsRejected() {
        PartitionSpec spec = PartitionSpec.of(ROOT, new TimeRangePartition("Logs-%Y-%m", Interval.MONTH));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class)
            .hasMessageContaining("Invalid table name 'Logs-2019-12'");
    }

    @Test
    void testOverlongIdentifierIsRejected() {
        String prefix = "a".repeat(60);
        PartitionSpec spec = PartitionSpec.of(ROOT, new TimeRangePartition(prefix + "_%Y", Interval.YEAR));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class)
            .hasMessageContaining("longer than 63 bytes");
    }

    @Test
    void testWeeksCannotSubdivideMonths() {
        PartitionSpec spec = PartitionSpec.of(ROOT,
            new TimeRangePartition("logs_%Y_%m", Interval.MONTH),
            new TimeRangePartition("logs_%G_w%V", Interval.WEEK));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class)
            .hasMessageContaining("cannot subdivide");
    }

    @Test
    void testCoarserChildIsRejected() {
        PartitionSpec spec = PartitionSpec.of(ROOT,
            new TimeRangePartition("logs_%Y_%m", Interval.MONTH),
            new TimeRangePartition("logs_%Y", Interval.YEAR));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class)
            .hasMessageContaining("cannot subdivide");
    }

    @Test
    void testNamesMayNotCollideAcrossLevels() {
        PartitionSpec spec = PartitionSpec.of(new RootPartition("logs_2020", "tstamp timestamptz not null"),
            new TimeRangePartition("logs_%Y", Interval.YEAR));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class)
            .hasMessageContaining("Table name logs_2020 is generated by both");
    }

    @Test
    void testRootMustComeFirst() {
        PartitionSpec spec = new PartitionSpec(
            List.of(new TimeRangePartition("logs_%Y_%m", Interval.MONTH), ROOT), ZoneId.of("UTC"));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class)
            .hasMessageContaining("must start with a root");
    }

    @Test
    void testSecondRootIsRejected() {
        PartitionSpec spec = new PartitionSpec(List.of(ROOT, new RootPartition("other", "x int")), ZoneId.of("UTC"));

        assertThatThrownBy(() -> PartitionSpecValidator.validate(spec))
            .isInstanceOf(PartitionResolutionException.class)
            .hasMessageContaining("Only the first partition entry may be a root");
    }
}
