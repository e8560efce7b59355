package com.newsrelay.core.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient parsing of the publish dates found in feeds and pages. Values without a zone
 * are read as UTC.
 */
public final class Timestamps {
    private static final List<DateTimeFormatter> ZONED_FORMATS = List.of(
            DateTimeFormatter.RFC_1123_DATE_TIME,
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss Z", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss z", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm Z", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMM yyyy HH:mm:ss Z", Locale.ENGLISH),
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME
    );
    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy HH:mm", Locale.ENGLISH)
    );

    private Timestamps() {
    }

    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        Optional<Instant> parsed = attempt(value, Instant::parse);
        for (int i = 0; parsed.isEmpty() && i < ZONED_FORMATS.size(); i++) {
            DateTimeFormatter format = ZONED_FORMATS.get(i);
            parsed = attempt(value, v -> ZonedDateTime.parse(v, format).toInstant());
        }
        for (int i = 0; parsed.isEmpty() && i < LOCAL_FORMATS.size(); i++) {
            DateTimeFormatter format = LOCAL_FORMATS.get(i);
            parsed = attempt(value, v -> LocalDateTime.parse(v, format).toInstant(ZoneOffset.UTC));
        }
        return parsed;
    }

    private static Optional<Instant> attempt(String value, Function<String, Instant> parser) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
