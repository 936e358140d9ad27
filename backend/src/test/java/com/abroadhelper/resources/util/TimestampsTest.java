package com.abroadhelper.resources.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampsTest {
    private static final ZoneId KATHMANDU = ZoneId.of("Asia/Kathmandu");

    @Test
    void readsOffsetFormsAsTheSameInstant() {
        Instant expected = Instant.parse("2024-01-15T10:30:00Z");

        assertThat(Timestamps.parse("2024-01-15T10:30:00Z", KATHMANDU)).contains(expected);
        assertThat(Timestamps.parse("2024-01-15T10:30:00+00:00", KATHMANDU)).contains(expected);
        assertThat(Timestamps.parse("2024-01-15 16:15:00+0545", KATHMANDU)).contains(expected);
        assertThat(Timestamps.parse("2024-01-15 05:30:00-05", KATHMANDU)).contains(expected);
    }

    @Test
    void valuesWithoutOffsetUseGivenZone() {
        assertThat(Timestamps.parseOffset("2024-01-15T16:15:00", KATHMANDU))
            .contains(OffsetDateTime.of(2024, 1, 15, 16, 15, 0, 0, ZoneOffset.ofHoursMinutes(5, 45)));
        assertThat(Timestamps.parse("2024-01-15", ZoneOffset.UTC))
            .contains(Instant.parse("2024-01-15T00:00:00Z"));
    }

    @Test
    void fractionalSecondsAreKept() {
        assertThat(Timestamps.parse("2024-01-15T10:30:00.123456+00:00", ZoneOffset.UTC))
            .contains(Instant.parse("2024-01-15T10:30:00.123456Z"));
    }

    @Test
    void rejectsNonsenseAndImpossibleDates() {
        assertThat(Timestamps.parse("not a date", ZoneOffset.UTC)).isEmpty();
        assertThat(Timestamps.parse("2024-13-01", ZoneOffset.UTC)).isEmpty();
        assertThat(Timestamps.parse("2023-02-29T00:00:00Z", ZoneOffset.UTC)).isEmpty();
        assertThat(Timestamps.parse("", ZoneOffset.UTC)).isEmpty();
        assertThat(Timestamps.parse(null, ZoneOffset.UTC)).isEmpty();
    }
}
