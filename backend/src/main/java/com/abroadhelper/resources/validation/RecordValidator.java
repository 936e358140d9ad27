package com.abroadhelper.resources.validation;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.model.ResourceCategory;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.StaleDataFinding;
import com.abroadhelper.resources.util.Timestamps;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Structural and date checks for a single record. No I/O. */
@Component
public class RecordValidator {
    public static final String INSTITUTION_MARKER = "institution (required for scholarships)";

    private final ResourceProperties properties;
    private final Clock clock;

    public RecordValidator(ResourceProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /** Names of blank required fields in the order title, category, country, institution. */
    public List<String> missingFields(ResourceRecord record) {
        List<String> missing = new ArrayList<>();
        if (isBlank(record.title())) {
            missing.add("title");
        }
        if (isBlank(record.category())) {
            missing.add("category");
        }
        if (isBlank(record.country())) {
            missing.add("country");
        }
        if (isScholarship(record) && isBlank(record.institution())) {
            missing.add(INSTITUTION_MARKER);
        }
        return missing;
    }

    public List<String> dateErrors(ResourceRecord record) {
        List<String> errors = new ArrayList<>();
        String deadline = record.deadline();
        if (!isBlank(deadline) && !isCalendarDate(deadline.trim())) {
            errors.add("Invalid deadline format: " + deadline);
        }
        String lastUpdated = record.lastUpdated();
        if (!isBlank(lastUpdated) && Timestamps.parse(lastUpdated, clock.getZone()).isEmpty()) {
            errors.add("Could not parse last_updated: " + lastUpdated);
        }
        return errors;
    }

    /**
     * A finding when {@code last_updated} is older than the stale threshold. Unparseable values
     * are left to {@link #dateErrors}.
     */
    public Optional<StaleDataFinding> staleness(ResourceRecord record) {
        if (isBlank(record.lastUpdated())) {
            return Optional.empty();
        }
        Optional<Instant> updatedAt = Timestamps.parse(record.lastUpdated(), clock.getZone());
        if (updatedAt.isEmpty()) {
            return Optional.empty();
        }
        // Wall-clock days in the clock's zone, so a DST shift never shortens the age.
        LocalDateTime updatedLocal = updatedAt.get().atZone(clock.getZone()).toLocalDateTime();
        long daysOld = ChronoUnit.DAYS.between(updatedLocal, LocalDateTime.now(clock));
        if (daysOld > properties.getValidation().getStaleThresholdDays()) {
            return Optional.of(new StaleDataFinding(record.id(), record.title(), daysOld, record.lastUpdated()));
        }
        return Optional.empty();
    }

    private static boolean isCalendarDate(String value) {
        try {
            LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isScholarship(ResourceRecord record) {
        return ResourceCategory.fromValue(record.category())
            .filter(category -> category == ResourceCategory.SCHOLARSHIP)
            .isPresent();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
