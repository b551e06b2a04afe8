package com.dqlproxy.shaping;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Converts record timestamps to epoch milliseconds.
 *
 * Accepted inputs:
 * - numbers below 10^12: epoch seconds (fractions kept down to the millisecond)
 * - numbers from 10^12: epoch milliseconds
 * - ISO-8601 text, with or without offset (no offset means UTC)
 *
 * Anything else is unusable and yields an empty result, never zero.
 */
public final class TimestampNormalizer {

    /**
     * Numbers below this are seconds, at or above it milliseconds.
     */
    public static final long MILLIS_THRESHOLD = 1_000_000_000_000L;

    private TimestampNormalizer() {
        // Utility class, no instantiation
    }

    public static OptionalLong toEpochMillis(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return OptionalLong.empty();
        }
        if (value.isNumber()) {
            return fromNumber(value);
        }
        if (value.isTextual()) {
            return fromText(value.asText());
        }
        // booleans, objects, arrays
        return OptionalLong.empty();
    }

    private static OptionalLong fromNumber(JsonNode value) {
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            long number = value.longValue();
            if (number >= MILLIS_THRESHOLD) {
                return OptionalLong.of(number);
            }
            try {
                return OptionalLong.of(Math.multiplyExact(number, 1000L));
            } catch (ArithmeticException e) {
                return OptionalLong.empty();
            }
        }
        double number = value.doubleValue();
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(number < MILLIS_THRESHOLD ? (long) (number * 1000) : (long) number);
    }

    static OptionalLong fromText(String text) {
        String iso = text.trim().replace("Z", "+00:00");
        if (iso.isEmpty()) {
            return OptionalLong.empty();
        }
        // "2024-01-01 10:00:00" is common in DQL output
        if (iso.length() > 10 && iso.charAt(10) == ' ') {
            iso = iso.substring(0, 10) + 'T' + iso.substring(11);
        }

        OptionalLong parsed = parseIso(iso);
        if (parsed.isPresent()) {
            return parsed;
        }

        // Retry without fractional seconds and offset, read as UTC
        int dot = iso.indexOf('.');
        if (dot > 0) {
            return parseLocal(iso.substring(0, dot));
        }
        return OptionalLong.empty();
    }

    private static OptionalLong parseIso(String iso) {
        OptionalLong withOffset = attempt(() -> OffsetDateTime.parse(iso, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                .toInstant());
        if (withOffset.isPresent()) {
            return withOffset;
        }
        OptionalLong local = parseLocal(iso);
        if (local.isPresent()) {
            return local;
        }
        return attempt(() -> LocalDate.parse(iso, DateTimeFormatter.ISO_LOCAL_DATE)
                .atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    private static OptionalLong parseLocal(String iso) {
        return attempt(() -> LocalDateTime.parse(iso, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                .toInstant(ZoneOffset.UTC));
    }

    private static OptionalLong attempt(Supplier<Instant> parser) {
        try {
            return OptionalLong.of(parser.get().toEpochMilli());
        } catch (DateTimeParseException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }
}
