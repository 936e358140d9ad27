package com.abroadhelper.resources.validation;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.StaleDataFinding;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RecordValidatorTest {
    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
    private final RecordValidator validator = new RecordValidator(new ResourceProperties(), clock);

    @Test
    void reportsBlankRequiredFieldsInFixedOrder() {
        ResourceRecord record = record("r1", " ", null, "", null, null, null);

        assertThat(validator.missingFields(record)).containsExactly("title", "category", "country");
    }

    @Test
    void scholarshipRequiresInstitution() {
        assertThat(validator.missingFields(record("r1", "Lester B. Pearson", "scholarship", "Canada", null, null, null)))
            .containsExactly(RecordValidator.INSTITUTION_MARKER);
        assertThat(validator.missingFields(record("r2", "Study permit", "visa", "Canada", null, null, null)))
            .isEmpty();
        assertThat(validator.missingFields(record("r3", "Pearson", "Scholarship", "Canada", "University of Toronto", null, null)))
            .isEmpty();
    }

    @Test
    void deadlineMustBeARealCalendarDate() {
        assertThat(validator.dateErrors(record("r1", "T", "job", "Canada", null, "2024-02-30", null)))
            .containsExactly("Invalid deadline format: 2024-02-30");
        assertThat(validator.dateErrors(record("r2", "T", "job", "Canada", null, "15/02/2024", null)))
            .containsExactly("Invalid deadline format: 15/02/2024");
        assertThat(validator.dateErrors(record("r3", "T", "job", "Canada", null, "2024-02-15", null)))
            .isEmpty();
        assertThat(validator.dateErrors(record("r4", "T", "job", "Canada", null, null, null)))
            .isEmpty();
    }

    @Test
    void unparseableLastUpdatedIsADateErrorButNotStale() {
        ResourceRecord record = record("r1", "T", "job", "Canada", null, null, "last tuesday");

        assertThat(validator.dateErrors(record)).containsExactly("Could not parse last_updated: last tuesday");
        assertThat(validator.staleness(record)).isEmpty();
    }

    @Test
    void staleOnlyWhenOlderThanThreshold() {
        Optional<StaleDataFinding> stale = validator.staleness(
            record("r1", "Old", "visa", "Canada", null, null, "2024-03-02T00:00:00Z"));
        Optional<StaleDataFinding> fresh = validator.staleness(
            record("r2", "Fresh", "visa", "Canada", null, null, "2024-03-03T00:00:00Z"));

        assertThat(stale).contains(new StaleDataFinding("r1", "Old", 91, "2024-03-02T00:00:00Z"));
        assertThat(fresh).isEmpty();
    }

    @Test
    void lastUpdatedAcceptsStoreAndOffsetForms() {
        List<String> sameInstant = List.of(
            "2024-03-02 00:00:00+00",
            "2024-03-02T05:45:00+0545",
            "2024-03-02T05:45:00+05:45",
            "2024-03-01T19:00:00.000000-05:00",
            "2024-03-02T00:00:00",
            "2024-03-02"
        );
        for (String value : sameInstant) {
            ResourceRecord record = record("r", "T", "visa", "Canada", null, null, value);
            assertThat(validator.dateErrors(record)).as(value).isEmpty();
            assertThat(validator.staleness(record)).as(value)
                .map(StaleDataFinding::daysOld)
                .contains(91L);
        }
    }

    @Test
    void ageCountsCalendarDaysAcrossDaylightSavingChange() {
        Clock newYork = Clock.fixed(
            LocalDateTime.of(2024, 4, 1, 0, 30).atZone(ZoneId.of("America/New_York")).toInstant(),
            ZoneId.of("America/New_York")
        );
        RecordValidator local = new RecordValidator(new ResourceProperties(), newYork);

        assertThat(local.staleness(record("r1", "T", "visa", "Canada", null, null, "2024-01-01")))
            .map(StaleDataFinding::daysOld)
            .contains(91L);
        assertThat(local.staleness(record("r2", "T", "visa", "Canada", null, null, "2024-01-02"))).isEmpty();
    }

    @Test
    void thresholdComesFromConfiguration() {
        ResourceProperties properties = new ResourceProperties();
        properties.getValidation().setStaleThresholdDays(30);
        RecordValidator strict = new RecordValidator(properties, clock);

        assertThat(strict.staleness(record("r1", "T", "visa", "Canada", null, null, "2024-04-30T00:00:00Z"))).isPresent();
        assertThat(strict.staleness(record("r2", "T", "visa", "Canada", null, null, "2024-05-02T00:00:00Z"))).isEmpty();
    }

    private static ResourceRecord record(
        String id,
        String title,
        String category,
        String country,
        String institution,
        String deadline,
        String lastUpdated
    ) {
        return new ResourceRecord(
            id, title, null, null, category, country, institution, deadline,
            null, null, List.of(), lastUpdated, Map.of()
        );
    }
}
