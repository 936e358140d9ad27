package com.abroadhelper.resources.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient ISO-8601 timestamp reading. Accepts a bare date, a local date-time and a date-time with
 * a {@code Z}, {@code ±HH}, {@code ±HHmm} or {@code ±HH:mm} offset, separated by {@code T} or a
 * space (the form PostgreSQL prints).
 */
public final class Timestamps {
    private static final Pattern SPACE_SEPARATOR = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (?=\\d)");
    private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-]\\d{2})(\\d{2})$");
    private static final Pattern HOUR_OFFSET = Pattern.compile("([+-]\\d{2})$");

    private static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT)
        .withChronology(IsoChronology.INSTANCE);

    private Timestamps() {
    }

    /** Parses {@code text}; values without an offset are read in {@code zone}. */
    public static Optional<OffsetDateTime> parseOffset(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(text.trim());
        try {
            TemporalAccessor parsed = FLEXIBLE.parseBest(
                normalized,
                OffsetDateTime::from,
                LocalDateTime::from,
                LocalDate::from
            );
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return Optional.of(offsetDateTime);
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return Optional.of(localDateTime.atZone(zone).toOffsetDateTime());
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(zone).toOffsetDateTime());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static Optional<Instant> parse(String text, ZoneId zone) {
        return parseOffset(text, zone).map(OffsetDateTime::toInstant);
    }

    private static String normalize(String text) {
        String value = SPACE_SEPARATOR.matcher(text).replaceFirst("$1T");
        if (value.indexOf('T') < 0 && value.indexOf('t') < 0) {
            return value;
        }
        if (COMPACT_OFFSET.matcher(value).find() && hasTimeBeforeOffset(value)) {
            return COMPACT_OFFSET.matcher(value).replaceFirst("$1:$2");
        }
        if (HOUR_OFFSET.matcher(value).find() && hasTimeBeforeOffset(value)) {
            return HOUR_OFFSET.matcher(value).replaceFirst("$1:00");
        }
        return value;
    }

    private static boolean hasTimeBeforeOffset(String value) {
        int sign = Math.max(value.lastIndexOf('+'), value.lastIndexOf('-'));
        int separator = Math.max(value.indexOf('T'), value.indexOf('t'));
        return sign > separator && value.substring(separator, sign).contains(":");
    }
}
