/* (C)2026 */
package com.ammann.vibration.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.List;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Lenient coercion of raw cell values into timestamps and numbers.
 *
 * <p>Every method returns {@code null} for values it cannot interpret instead of throwing,
 * so callers can drop the offending row. Local date-times carry no zone and are read as UTC.
 */
public final class RawValueParser {

    private static final Logger LOG = Logger.getLogger(RawValueParser.class);

    private static final DateTimeFormatter SPACE_SEPARATED =
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyy-MM-dd HH:mm:ss")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .optionalEnd()
                    .toFormatter();

    private static final DateTimeFormatter SPACE_SEPARATED_MINUTES =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private static final List<Function<String, Instant>> TEXT_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            text -> LocalDateTime.parse(text, SPACE_SEPARATED).toInstant(ZoneOffset.UTC),
            text -> LocalDateTime.parse(text, SPACE_SEPARATED_MINUTES).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));

    private RawValueParser() {}

    /**
     * Coerces a raw value to an instant.
     *
     * <p>Numbers are read as epoch milliseconds, keeping any sub-millisecond fraction.
     * Strings may be an ISO-8601 instant or offset date-time, an ISO local date-time,
     * {@code yyyy-MM-dd HH:mm:ss[.fraction]}, or a bare date (start of day).
     *
     * @param value raw cell value, may be {@code null}
     * @return parsed instant or {@code null} when the value cannot be interpreted
     */
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate localDate) {
            return localDate.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number number) {
            return fromEpochMillis(number);
        }
        if (value instanceof CharSequence text) {
            return parseText(text.toString().trim());
        }
        return null;
    }

    /**
     * Coerces a raw value to a finite double.
     *
     * @param value raw cell value, may be {@code null}
     * @return numeric value or {@code null} for missing, non-numeric or non-finite input
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                parsed = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

    private static Instant fromEpochMillis(Number number) {
        if (number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return Instant.ofEpochMilli(number.longValue());
        }
        double millis = number.doubleValue();
        if (!Double.isFinite(millis)) {
            return null;
        }
        // sub-millisecond fractions are kept; seconds floor towards negative infinity
        BigDecimal seconds = (number instanceof BigDecimal decimal ? decimal : BigDecimal.valueOf(millis))
                .movePointLeft(3);
        BigDecimal wholeSeconds = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(wholeSeconds).movePointRight(9)
                .setScale(0, RoundingMode.HALF_UP).longValueExact();
        try {
            return Instant.ofEpochSecond(wholeSeconds.longValueExact(), nanos);
        } catch (ArithmeticException | DateTimeException e) {
            LOG.tracef("Epoch milliseconds %s out of range: %s", number, e.getMessage());
            return null;
        }
    }

    private static Instant parseText(String text) {
        if (text.isEmpty()) {
            return null;
        }
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : TEXT_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        LOG.tracef("Unparseable timestamp '%s': %s", text, lastFailure.getMessage());
        return null;
    }
}
