package com.raidxp.extractor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the timestamp captured from a log line as a UTC instant.
 *
 * <p>Formats are tried in order: {@code yyyy-MM-ddTHH:mm:ss}, {@code yyyy-MM-dd HH:mm:ss}
 * (both with optional fraction) and {@code HH:mm:ss}, which is placed on the current
 * UTC date. Values are read as UTC; a trailing {@code Z} or {@code UTC} is accepted.
 * When nothing parses the caller falls back to processing time.
 */
public final class TimestampParser {

    private static final DateTimeFormatter DATE_SPACE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter(Locale.ROOT);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DATE_SPACE_TIME);

    private final Clock clock;

    public TimestampParser(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Parses a captured timestamp.
     *
     * @return the instant, or empty when the value is blank or in no known format
     */
    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = stripZone(raw.trim());

        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            Optional<Instant> parsed = parseDateTime(value, format);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        try {
            LocalTime time = LocalTime.parse(value, DateTimeFormatter.ISO_LOCAL_TIME);
            LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
            return Optional.of(LocalDateTime.of(today, time).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseDateTime(String value, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDateTime.parse(value, format).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a captured timestamp, using processing time when it cannot be read.
     */
    public Instant parseOrNow(String raw) {
        return parse(raw).orElseGet(clock::instant);
    }

    private static String stripZone(String value) {
        if (value.endsWith("Z")) {
            return value.substring(0, value.length() - 1);
        }
        if (value.toUpperCase(Locale.ROOT).endsWith(" UTC")) {
            return value.substring(0, value.length() - 4).trim();
        }
        return value;
    }
}
