package com.geohub.tracker.service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;

/**
 * Lenient timestamp parsing for query parameters.
 *
 * Accepted forms (fraction of seconds optional, 0-9 digits):
 * <ul>
 *   <li>{@code 2020-11-30T20:12:36.444+01:00}</li>
 *   <li>{@code 2020-11-30T20:12:36.444Z}</li>
 *   <li>{@code 2020-11-30 20:12:36.444} (no zone: UTC)</li>
 * </ul>
 */
public final class TimestampParser {

    private static final DateTimeFormatter WITH_OFFSET = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
        .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
        .appendOffset("+HH:MM", "Z")
        .toFormatter();

    private static final List<DateTimeFormatter> WITHOUT_ZONE = List.of(
        new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .toFormatter(),
        new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .toFormatter()
    );

    private TimestampParser() {
    }

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        Optional<Instant> withOffset = parseWithOffset(trimmed);
        if (withOffset.isPresent()) {
            return withOffset;
        }
        for (DateTimeFormatter formatter : WITHOUT_ZONE) {
            Optional<Instant> utc = parseAsUtc(trimmed, formatter);
            if (utc.isPresent()) {
                return utc;
            }
        }
        return Optional.empty();
    }

    public static Instant parseOr(String value, Instant fallback) {
        return parse(value).orElse(fallback);
    }

    private static Optional<Instant> parseWithOffset(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value, WITH_OFFSET).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseAsUtc(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDateTime.parse(value, formatter).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
