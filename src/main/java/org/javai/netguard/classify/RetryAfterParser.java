package org.javai.netguard.classify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.OptionalInt;

/**
 * Parses a {@code Retry-After} header: either delta-seconds or an HTTP-date.
 */
final class RetryAfterParser {

    private RetryAfterParser() {
    }

    static OptionalInt parseSeconds(String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return OptionalInt.empty();
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds < 0 ? OptionalInt.empty() : OptionalInt.of((int) Math.min(seconds, Integer.MAX_VALUE));
        } catch (NumberFormatException e) {
            return parseDate(trimmed, clock);
        }
    }

    private static OptionalInt parseDate(String value, Clock clock) {
        try {
            Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            long seconds = Duration.between(clock.instant(), at).toSeconds();
            return OptionalInt.of((int) Math.max(0, Math.min(seconds, Integer.MAX_VALUE)));
        } catch (DateTimeParseException e) {
            return OptionalInt.empty();
        }
    }
}
