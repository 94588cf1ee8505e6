package com.orderdesk.querysupport.aggregation;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PeriodBucketerTests {

    private final List<Instant> acrossNewYear = List.of(
            Instant.parse("2025-01-02T09:00:00Z"),
            Instant.parse("2024-12-31T23:59:59Z"),
            Instant.parse("2024-12-30T10:00:00Z"),
            Instant.parse("2025-01-09T00:00:00Z"));

    @Test
    void shouldOrderDaysAcrossYearBoundary() {
        SortedMap<PeriodKey, List<Instant>> buckets =
                PeriodBucketer.group(acrossNewYear, t -> t, PeriodUnit.DAY);

        assertThat(buckets.keySet()).extracting(PeriodKey::label)
                .containsExactly("2024-12-30", "2024-12-31", "2025-01-02", "2025-01-09");
    }

    @Test
    void shouldNumberWeeksFromFirstDayOfYear() {
        SortedMap<PeriodKey, List<Instant>> buckets =
                PeriodBucketer.group(acrossNewYear, t -> t, PeriodUnit.WEEK);

        // 2024 is a leap year: day 365 and 366 fall into week 53
        assertThat(buckets.keySet()).extracting(PeriodKey::label)
                .containsExactly("2024-W53", "2025-W01", "2025-W02");
        assertThat(buckets.get(buckets.firstKey())).hasSize(2);
    }

    @Test
    void shouldGroupMonths() {
        SortedMap<PeriodKey, List<Instant>> buckets =
                PeriodBucketer.group(acrossNewYear, t -> t, PeriodUnit.MONTH);

        assertThat(buckets.keySet()).extracting(PeriodKey::label)
                .containsExactly("2024-12", "2025-01");
        assertThat(buckets.get(buckets.lastKey())).hasSize(2);
    }

    @Test
    void shouldUseUtcCalendarDate() {
        SortedMap<PeriodKey, List<Instant>> buckets = PeriodBucketer.group(
                List.of(OffsetDateTime.parse("2025-03-01T00:30:00+02:00").toInstant()), t -> t, PeriodUnit.DAY);

        assertThat(buckets.firstKey().label()).isEqualTo("2025-02-28");
    }

    @Test
    void shouldParseUnitCaseInsensitively() {
        assertThat(PeriodUnit.parse("Week")).isEqualTo(PeriodUnit.WEEK);
        assertThat(PeriodUnit.parse(" MONTH ")).isEqualTo(PeriodUnit.MONTH);
        assertThat(PeriodUnit.parse(null)).isEqualTo(PeriodUnit.DAY);
        assertThatThrownBy(() -> PeriodUnit.parse("year"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
